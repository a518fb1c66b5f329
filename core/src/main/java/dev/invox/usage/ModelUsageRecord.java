package dev.invox.usage;

import java.util.Objects;

/**
 * Request counters for one Gemini model.
 *
 * @param model             model identifier, the record key
 * @param day               day key ({@code yyyy-MM-dd}) the daily counter belongs to
 * @param minuteWindowStart epoch millis at which the current minute window opened
 * @param requestsMinute    requests granted in the current minute window
 * @param requestsToday     requests granted on {@link #day()}
 */
public record ModelUsageRecord(
    String model,
    String day,
    long minuteWindowStart,
    int requestsMinute,
    int requestsToday
) {

    public ModelUsageRecord {
        Objects.requireNonNull(model, "model must not be null");
        if (requestsMinute < 0 || requestsToday < 0) {
            throw new IllegalArgumentException("Usage counters must not be negative");
        }
    }

    public static ModelUsageRecord empty(String model, String day, long now) {
        return new ModelUsageRecord(model, day, now, 0, 0);
    }

    public ModelUsageRecord startDay(String newDay) {
        return new ModelUsageRecord(model, newDay, minuteWindowStart, requestsMinute, 0);
    }

    public ModelUsageRecord startMinuteWindow(long windowStart) {
        return new ModelUsageRecord(model, day, windowStart, 0, requestsToday);
    }

    public ModelUsageRecord increment() {
        return new ModelUsageRecord(model, day, minuteWindowStart, requestsMinute + 1, requestsToday + 1);
    }
}
