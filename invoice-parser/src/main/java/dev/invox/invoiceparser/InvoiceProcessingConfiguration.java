package dev.invox.invoiceparser;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.invox.files.FileTaskRepository;
import dev.invox.invoiceparser.catalog.ModelCatalogProperties;
import dev.invox.invoiceparser.catalog.ModelCatalogRepository;
import dev.invox.invoiceparser.googleai.GeminiClient;
import dev.invox.invoiceparser.googleai.GeminiGenerationOptions;
import dev.invox.invoiceparser.googleai.GoogleAiGeminiClient;
import dev.invox.invoiceparser.usage.ModelLockRegistry;
import dev.invox.invoiceparser.usage.ModelUsageSynchronizer;
import dev.invox.invoiceparser.usage.Sleeper;
import dev.invox.invoiceparser.usage.UsageTracker;
import dev.invox.storage.FileContentReader;
import dev.invox.storage.InvoiceStorageConfig;
import dev.invox.usage.ModelUsageRepository;
import io.micrometer.observation.ObservationRegistry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the extraction pipeline: model catalog, usage tracking, Gemini client and batch orchestration.
 * Storage beans come from {@link FirestoreConfiguration} or the local test profile.
 */
@Configuration
@Import(InvoiceStorageConfig.class)
@EnableConfigurationProperties({InvoiceProcessingProperties.class, ModelCatalogProperties.class})
public class InvoiceProcessingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceProcessingConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GeminiGenerationOptions geminiGenerationOptions(Environment environment) {
        String modelName = environment.getProperty("google.ai.gemini.model", "gemini-2.5-flash");
        Double temperature = environment.getProperty("google.ai.gemini.temperature", Double.class, 0.0d);
        Double topP = environment.getProperty("google.ai.gemini.top-p", Double.class);
        Integer topK = environment.getProperty("google.ai.gemini.top-k", Integer.class);
        Integer maxOutputTokens = environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class);
        LOGGER.info("Configured Google AI Gemini settings - model: {}, temperature: {}, topP: {}, topK: {}, maxOutputTokens: {}",
            modelName, temperature, topP, topK, maxOutputTokens);
        return new GeminiGenerationOptions(modelName, temperature, topP, topK, maxOutputTokens);
    }

    @Bean
    public GeminiClient geminiClient(Environment environment, GeminiGenerationOptions geminiGenerationOptions,
        ObjectProvider<RestClient.Builder> restClientBuilder, ObjectProvider<ObservationRegistry> observationRegistry) {

        String baseUrl = environment.getProperty("google.ai.gemini.base-url", GoogleAiGeminiClient.DEFAULT_BASE_URL);
        RestClient restClient = restClientBuilder.getIfAvailable(RestClient::builder).baseUrl(baseUrl).build();
        ObservationRegistry resolvedObservationRegistry = observationRegistry
            .getIfAvailable(() -> ObservationRegistry.NOOP);
        GoogleAiGeminiClient client = new GoogleAiGeminiClient(restClient, geminiGenerationOptions,
            resolvedObservationRegistry);
        LOGGER.info("Google AI Gemini client targets {} with default options {}", baseUrl, client.getDefaultOptions());
        return client;
    }

    @Bean
    public CredentialProvider credentialProvider(Environment environment) {
        return new EnvironmentCredentialProvider(environment);
    }

    @Bean
    public ModelCatalogRepository modelCatalogRepository(ModelCatalogProperties modelCatalogProperties,
        ObjectMapper objectMapper, ObjectProvider<RestClient.Builder> restClientBuilder,
        ApplicationEventPublisher eventPublisher) {
        return new ModelCatalogRepository(modelCatalogProperties, objectMapper,
            restClientBuilder.getIfAvailable(RestClient::builder).build(), eventPublisher);
    }

    @Bean
    public ModelLockRegistry modelLockRegistry() {
        return new ModelLockRegistry();
    }

    @Bean
    public UsageTracker usageTracker(ModelUsageRepository modelUsageRepository, ModelLockRegistry modelLockRegistry,
        Clock clock, InvoiceProcessingProperties invoiceProcessingProperties) {
        return new UsageTracker(modelUsageRepository, modelLockRegistry, clock, Sleeper.THREAD,
            invoiceProcessingProperties.getUsageZone());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService usageSyncExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("usage-sync-"));
    }

    @Bean
    public ModelUsageSynchronizer modelUsageSynchronizer(UsageTracker usageTracker,
        @Qualifier("usageSyncExecutor") ExecutorService usageSyncExecutor) {
        return new ModelUsageSynchronizer(usageTracker, usageSyncExecutor);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService geminiCallExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("gemini-call-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public InvoicePrompts invoicePrompts(ObjectMapper objectMapper) {
        return InvoicePrompts.load(objectMapper);
    }

    @Bean
    public ExtractionInvoker extractionInvoker(GeminiClient geminiClient, ObjectMapper objectMapper,
        InvoicePrompts invoicePrompts, @Qualifier("geminiCallExecutor") ExecutorService geminiCallExecutor,
        InvoiceProcessingProperties invoiceProcessingProperties) {
        return new ExtractionInvoker(geminiClient, objectMapper, invoicePrompts, geminiCallExecutor,
            invoiceProcessingProperties.getAttemptTimeout());
    }

    @Bean
    public ModelSequencer modelSequencer(UsageTracker usageTracker, ExtractionInvoker extractionInvoker,
        ModelCatalogRepository modelCatalogRepository) {
        return new ModelSequencer(usageTracker, extractionInvoker, modelCatalogRepository::current);
    }

    @Bean
    public BatchOrchestrator batchOrchestrator(FileTaskRepository fileTaskRepository,
        FileContentReader fileContentReader, ModelSequencer modelSequencer, CredentialProvider credentialProvider,
        ObjectMapper objectMapper) {
        return new BatchOrchestrator(fileTaskRepository, fileContentReader, modelSequencer, credentialProvider,
            objectMapper);
    }
}
