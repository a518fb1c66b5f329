package dev.invox.invoiceparser;

/**
 * How a failed extraction attempt affects the remaining candidate models.
 */
public enum FailureClassification {

    /** Quota or rate limit reached; the next model is tried. */
    RATE_LIMITED,

    /** The attempt exceeded its time budget; the next model is tried. */
    TIMED_OUT,

    /** Any other error; no further model is tried for the file. */
    OTHER;

    public boolean allowsNextModel() {
        return this != OTHER;
    }
}
