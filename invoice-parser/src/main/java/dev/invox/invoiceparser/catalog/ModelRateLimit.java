package dev.invox.invoiceparser.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Published quota for one Gemini model. A zero {@code rpm} or {@code rpd} means that dimension is not metered.
 *
 * @param rpm        requests per minute
 * @param rpd        requests per day
 * @param concurrent concurrent requests the model tolerates
 */
public record ModelRateLimit(int rpm, int rpd, int concurrent) {

    /**
     * Base limit for models that have no entry in the catalog.
     */
    public static final ModelRateLimit UNMETERED = new ModelRateLimit(0, 0, 1);

    public ModelRateLimit {
        if (rpm < 0 || rpd < 0 || concurrent < 0) {
            throw new IllegalArgumentException("Rate limits must not be negative");
        }
    }

    @JsonIgnore
    public boolean isUnmetered() {
        return rpm == 0 && rpd == 0;
    }
}
