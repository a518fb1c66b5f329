package dev.invox.invoiceparser;

/**
 * Signals a systemic failure of a batch, as opposed to the failure of a single file.
 */
public class InvoiceProcessingException extends RuntimeException {

    public InvoiceProcessingException(String message) {
        super(message);
    }

    public InvoiceProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
