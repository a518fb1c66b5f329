package dev.invox.invoiceparser.catalog;

/**
 * Raised when a remote catalog cannot be fetched or parsed.
 */
public class ModelCatalogException extends RuntimeException {

    public ModelCatalogException(String message) {
        super(message);
    }

    public ModelCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
