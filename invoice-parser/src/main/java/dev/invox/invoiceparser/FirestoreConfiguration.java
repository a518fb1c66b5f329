package dev.invox.invoiceparser;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import dev.invox.files.FileTaskRepository;
import dev.invox.files.FirestoreFileTaskRepository;
import dev.invox.usage.FirestoreModelUsageRepository;
import dev.invox.usage.ModelUsageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.util.StringUtils;

/**
 * Firestore-backed storage for the deployed service.
 */
@Configuration
@Profile("!local-invoice-test")
public class FirestoreConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreConfiguration.class);

    @Bean
    public InvoiceProcessingSettings invoiceProcessingSettings() {
        return InvoiceProcessingSettings.fromEnvironment();
    }

    @Bean
    public Firestore firestore(InvoiceProcessingSettings invoiceProcessingSettings) {
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder();
        if (StringUtils.hasText(invoiceProcessingSettings.projectId())) {
            optionsBuilder.setProjectId(invoiceProcessingSettings.projectId());
        }
        Firestore firestore = optionsBuilder.build().getService();
        LOGGER.info("Initialized Firestore client for project '{}' (files collection '{}', usage collection '{}')",
            firestore.getOptions().getProjectId(), invoiceProcessingSettings.filesCollection(),
            invoiceProcessingSettings.modelUsageCollection());
        return firestore;
    }

    @Bean
    public FileTaskRepository fileTaskRepository(Firestore firestore,
        InvoiceProcessingSettings invoiceProcessingSettings) {
        return new FirestoreFileTaskRepository(firestore, invoiceProcessingSettings.filesCollection());
    }

    @Bean
    public ModelUsageRepository modelUsageRepository(Firestore firestore,
        InvoiceProcessingSettings invoiceProcessingSettings) {
        return new FirestoreModelUsageRepository(firestore, invoiceProcessingSettings.modelUsageCollection());
    }
}
