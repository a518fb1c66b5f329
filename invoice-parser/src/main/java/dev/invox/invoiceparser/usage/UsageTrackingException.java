package dev.invox.invoiceparser.usage;

/**
 * Raised when a usage claim cannot complete, for example because the waiting thread was interrupted.
 */
public class UsageTrackingException extends RuntimeException {

    public UsageTrackingException(String message) {
        super(message);
    }

    public UsageTrackingException(String message, Throwable cause) {
        super(message, cause);
    }
}
