package dev.invox.invoiceparser;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Final result of running one file through the candidate models.
 *
 * @param fileId       id of the file task
 * @param model        model that produced the payload, {@code null} on failure
 * @param payload      extracted invoice, {@code null} on failure
 * @param rawFallback  whether the payload wraps unparsed model text
 * @param errorMessage last error message, {@code null} on success
 * @param statusCode   {@code 429} when the last attempt was rate limited, otherwise {@code null}
 */
public record FileExtractionResult(
    String fileId,
    String model,
    JsonNode payload,
    boolean rawFallback,
    String errorMessage,
    Integer statusCode
) {

    public static FileExtractionResult success(String fileId, String model, JsonNode payload, boolean rawFallback) {
        return new FileExtractionResult(fileId, model, payload, rawFallback, null, null);
    }

    public static FileExtractionResult failure(String fileId, String errorMessage, Integer statusCode) {
        return new FileExtractionResult(fileId, null, null, false, errorMessage, statusCode);
    }

    public boolean isSuccess() {
        return payload != null;
    }
}
