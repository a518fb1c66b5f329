package dev.invox.invoiceparser;

/**
 * Raised before a batch starts when no Gemini API key is configured.
 */
public class CredentialMissingException extends RuntimeException {

    public CredentialMissingException(String message) {
        super(message);
    }
}
