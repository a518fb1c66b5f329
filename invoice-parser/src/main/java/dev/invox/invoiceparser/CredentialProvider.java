package dev.invox.invoiceparser;

/**
 * Supplies the Google AI Studio API key used for extraction calls.
 */
public interface CredentialProvider {

    /**
     * @return the API key, or {@code null} when none is configured
     */
    String getApiKey();
}
