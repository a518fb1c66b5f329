package dev.invox.invoiceparser.googleai;

import java.util.Map;
import java.util.Objects;

/**
 * One extraction request for the {@code generateContent} endpoint.
 *
 * @param model              Gemini model to call
 * @param systemInstruction  system instruction sent alongside the prompt
 * @param userPrompt         user prompt describing the requested output
 * @param responseJsonSchema JSON schema the response must follow; may be {@code null}
 * @param fileBytes          document content, sent as inline base64 data
 * @param mimeType           content type of {@code fileBytes}
 */
public record GeminiContentRequest(
    String model,
    String systemInstruction,
    String userPrompt,
    Map<String, Object> responseJsonSchema,
    byte[] fileBytes,
    String mimeType
) {

    public GeminiContentRequest {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(fileBytes, "fileBytes must not be null");
    }

    @Override
    public String toString() {
        return "GeminiContentRequest{model=%s, mimeType=%s, bytes=%d}".formatted(model, mimeType, fileBytes.length);
    }
}
