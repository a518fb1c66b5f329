package dev.invox.storage;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

/**
 * Wires the {@link FileContentReader} used to load invoice documents. A Cloud Storage client is only created when
 * {@code gcs.enabled=true}; without it the reader serves local files alone.
 */
@Configuration
@EnableConfigurationProperties(GcsProperties.class)
public class InvoiceStorageConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceStorageConfig.class);

    @Bean
    @ConditionalOnProperty(value = "gcs.enabled", havingValue = "true")
    @ConditionalOnMissingBean
    public Storage storage(GcsProperties properties, ResourceLoader resourceLoader) throws IOException {
        GoogleCredentials credentials = serviceAccountCredentials(properties.getCredentials(), resourceLoader)
            .orElse(null);
        if (credentials == null) {
            LOGGER.info("Cloud Storage client uses application default credentials");
            credentials = GoogleCredentials.getApplicationDefault();
        }

        StorageOptions.Builder options = StorageOptions.newBuilder().setCredentials(credentials);
        if (StringUtils.hasText(properties.getProjectId())) {
            options.setProjectId(properties.getProjectId());
        }
        return options.build().getService();
    }

    @Bean
    @ConditionalOnMissingBean
    public FileContentReader fileContentReader(ObjectProvider<Storage> storage) {
        Storage client = storage.getIfAvailable();
        LOGGER.info("Invoice files will be read from the local filesystem{}",
            client != null ? " and Google Cloud Storage" : "");
        return new StorageFileContentReader(client);
    }

    static Optional<GoogleCredentials> serviceAccountCredentials(String location, ResourceLoader resourceLoader)
        throws IOException {
        if (!StringUtils.hasText(location)) {
            return Optional.empty();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            LOGGER.warn("Service account file {} does not exist; ignoring it", location);
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            return Optional.of(GoogleCredentials.fromStream(in));
        }
    }
}
