package dev.invox.invoiceparser;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of one extraction attempt against one model. Exactly one of {@code payload} and
 * {@code classification} is set.
 */
public record ExtractionOutcome(
    JsonNode payload,
    boolean rawFallback,
    String errorMessage,
    FailureClassification classification
) {

    public static ExtractionOutcome success(JsonNode payload, boolean rawFallback) {
        return new ExtractionOutcome(payload, rawFallback, null, null);
    }

    public static ExtractionOutcome failure(String errorMessage, FailureClassification classification) {
        return new ExtractionOutcome(null, false, errorMessage, classification);
    }

    public boolean isSuccess() {
        return classification == null;
    }
}
