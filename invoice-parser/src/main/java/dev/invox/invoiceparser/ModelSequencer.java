package dev.invox.invoiceparser;

import dev.invox.invoiceparser.catalog.ModelCatalog;
import dev.invox.invoiceparser.usage.DailyRateLimitExceededException;
import dev.invox.invoiceparser.usage.UsageTracker;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries the candidate models for one file in priority order. Rate-limited and timed-out attempts move on to the
 * next model, any other failure ends the search for that file.
 */
public class ModelSequencer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModelSequencer.class);

    private final UsageTracker usageTracker;
    private final ExtractionInvoker extractionInvoker;
    private final Supplier<ModelCatalog> catalogSupplier;

    public ModelSequencer(UsageTracker usageTracker, ExtractionInvoker extractionInvoker,
        Supplier<ModelCatalog> catalogSupplier) {
        this.usageTracker = usageTracker;
        this.extractionInvoker = extractionInvoker;
        this.catalogSupplier = catalogSupplier;
    }

    /**
     * @return the default model followed by the fallback order, without duplicates
     */
    public List<String> resolveOrder() {
        ModelCatalog catalog = catalogSupplier.get();
        Set<String> ordered = new LinkedHashSet<>();
        ordered.add(catalog.defaultModel());
        ordered.addAll(catalog.effectiveFallbackOrder());
        return List.copyOf(ordered);
    }

    public FileExtractionResult run(InvoiceInput input, List<String> models, String apiKey) {
        ModelCatalog catalog = catalogSupplier.get();
        String lastMessage = null;
        FailureClassification lastClassification = null;

        for (String model : models) {
            InvoiceProcessingMdc.attachModel(model);
            try {
                usageTracker.claim(model, catalog.rateLimitFor(model));
            } catch (DailyRateLimitExceededException ex) {
                LOGGER.warn("Skipping Gemini model {} for {}: {}", model, input.label(), ex.getMessage());
                lastMessage = ex.getMessage();
                lastClassification = FailureClassification.RATE_LIMITED;
                continue;
            } catch (RuntimeException ex) {
                LOGGER.error("Failed to reserve a request on Gemini model {} for {}", model, input.label(), ex);
                lastMessage = ErrorClassifier.messageOf(ex);
                lastClassification = ErrorClassifier.classify(ex);
                if (!lastClassification.allowsNextModel()) {
                    break;
                }
                continue;
            }

            ExtractionOutcome outcome = extractionInvoker.invoke(input, model, apiKey);
            if (outcome.isSuccess()) {
                LOGGER.info("Extracted {} with Gemini model {}", input.label(), model);
                return FileExtractionResult.success(input.fileId(), model, outcome.payload(), outcome.rawFallback());
            }

            lastMessage = outcome.errorMessage();
            lastClassification = outcome.classification();
            if (!lastClassification.allowsNextModel()) {
                LOGGER.warn("Not trying further models for {} after {} failure on {}", input.label(),
                    lastClassification, model);
                break;
            }
        }

        String message = lastMessage != null ? lastMessage : "Unknown error";
        Integer statusCode = lastClassification == FailureClassification.RATE_LIMITED
            ? ErrorClassifier.TOO_MANY_REQUESTS
            : null;
        return FileExtractionResult.failure(input.fileId(), message, statusCode);
    }
}
