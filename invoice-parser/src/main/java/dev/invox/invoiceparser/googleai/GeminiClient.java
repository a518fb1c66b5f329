package dev.invox.invoiceparser.googleai;

/**
 * Minimal client interface for invoking Google AI Studio's Gemini API.
 */
public interface GeminiClient {

    /**
     * @return the generation options used when a request does not override them
     */
    GeminiGenerationOptions getDefaultOptions();

    /**
     * Sends one document to Gemini and returns the first text part of the answer.
     *
     * @param request the prompt, schema and inline document to send
     * @param apiKey  the Google AI Studio API key used for this call
     * @return the generated text, or an empty string when Gemini produced no text part
     * @throws GeminiApiException when the API rejects the request or cannot be reached
     */
    String generateContent(GeminiContentRequest request, String apiKey);
}
