package dev.invox.invoiceparser.googleai;

/**
 * Signals that a Gemini API call failed. Carries the HTTP status when the API answered.
 */
public class GeminiApiException extends RuntimeException {

    private final int statusCode;

    public GeminiApiException(String message, Throwable cause) {
        this(0, message, cause);
    }

    public GeminiApiException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return the HTTP status returned by the API, or {@code 0} when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
