package dev.invox.invoiceparser.usage;

/**
 * Thrown when a model has used its whole daily request allowance.
 */
public class DailyRateLimitExceededException extends RuntimeException {

    private final String model;
    private final int dailyLimit;

    public DailyRateLimitExceededException(String model, int dailyLimit) {
        super("Gemini model %s exceeded daily rate limit (%d). Reset the daily counter to continue."
            .formatted(model, dailyLimit));
        this.model = model;
        this.dailyLimit = dailyLimit;
    }

    public String getModel() {
        return model;
    }

    public int getDailyLimit() {
        return dailyLimit;
    }
}
