package dev.invox.invoiceparser;

import dev.invox.invoiceparser.catalog.ModelCatalog;
import dev.invox.invoiceparser.catalog.ModelCatalogRepository;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Emits diagnostic logging when the service boots and loads the model catalog, which schedules the background
 * creation of missing usage records.
 */
@Component
public class InvoiceProcessorDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceProcessorDiagnostics.class);

    private final Environment environment;
    private final ModelCatalogRepository modelCatalogRepository;
    private final CredentialProvider credentialProvider;
    private final InvoiceProcessingProperties invoiceProcessingProperties;

    public InvoiceProcessorDiagnostics(Environment environment, ModelCatalogRepository modelCatalogRepository,
        CredentialProvider credentialProvider, InvoiceProcessingProperties invoiceProcessingProperties) {
        this.environment = environment;
        this.modelCatalogRepository = modelCatalogRepository;
        this.credentialProvider = credentialProvider;
        this.invoiceProcessingProperties = invoiceProcessingProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Invox invoice processor diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Attempt timeout {}, usage day zone {}", invoiceProcessingProperties.getAttemptTimeout(),
            invoiceProcessingProperties.getUsageZone());
        if (credentialProvider.getApiKey() == null) {
            LOGGER.warn("No Gemini API key configured (GEMINI_API_KEY / AI_STUDIO_API_KEY); batches will be rejected");
        }
        ModelCatalog catalog = modelCatalogRepository.current();
        LOGGER.info("Gemini model catalog - default: {}, fallback order: {}", catalog.defaultModel(),
            catalog.effectiveFallbackOrder());
    }
}
