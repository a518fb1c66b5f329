package dev.invox.storage;

/**
 * Signals that a file or usage record could not be read from or written to storage.
 */
public class InvoiceStorageException extends RuntimeException {

    public InvoiceStorageException(String message) {
        super(message);
    }

    public InvoiceStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
