package dev.invox.invoiceparser.usage;

import dev.invox.invoiceparser.catalog.ModelRateLimit;
import dev.invox.usage.ModelUsageRecord;
import dev.invox.usage.ModelUsageRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admission control for Gemini requests. Each model carries a requests-per-minute window and a requests-per-day
 * counter; {@link #claim(String, ModelRateLimit)} waits out a full minute window and fails once the daily
 * allowance is used.
 */
public class UsageTracker {

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Los_Angeles");
    static final long MINUTE_WINDOW_MILLIS = 60_000L;

    private static final Logger LOGGER = LoggerFactory.getLogger(UsageTracker.class);
    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final ModelUsageRepository repository;
    private final ModelLockRegistry locks;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ZoneId zone;

    public UsageTracker(ModelUsageRepository repository, ModelLockRegistry locks, Clock clock, Sleeper sleeper,
        ZoneId zone) {
        this.repository = repository;
        this.locks = locks;
        this.clock = clock;
        this.sleeper = sleeper;
        this.zone = zone != null ? zone : DEFAULT_ZONE;
    }

    /**
     * Reserves one request for {@code model}. Returns once the request may be sent.
     *
     * @throws DailyRateLimitExceededException when the model has no daily allowance left
     * @throws UsageTrackingException          when the thread is interrupted while waiting
     */
    public void claim(String model, ModelRateLimit limit) {
        ModelRateLimit effective = limit != null ? limit : ModelRateLimit.UNMETERED;
        if (effective.isUnmetered()) {
            return;
        }

        ReentrantLock lock = locks.lockFor(model);
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new UsageTrackingException("Interrupted while waiting for usage lock of model " + model, ex);
        }
        try {
            claimLocked(model, effective);
        } finally {
            lock.unlock();
        }
    }

    private void claimLocked(String model, ModelRateLimit limit) {
        long now = clock.millis();
        String today = dayKey(now);

        ModelUsageRecord record = repository.load(model)
            .orElseGet(() -> ModelUsageRecord.empty(model, today, now));

        if (!today.equals(record.day())) {
            record = record.startDay(today);
        }
        if (now - record.minuteWindowStart() >= MINUTE_WINDOW_MILLIS) {
            record = record.startMinuteWindow(now);
        }

        if (limit.rpd() > 0 && record.requestsToday() >= limit.rpd()) {
            throw new DailyRateLimitExceededException(model, limit.rpd());
        }

        if (limit.rpm() > 0 && record.requestsMinute() >= limit.rpm()) {
            long waitMillis = Math.max(0, MINUTE_WINDOW_MILLIS - (now - record.minuteWindowStart()));
            if (waitMillis > 0) {
                LOGGER.info("Gemini model {} reached {} requests per minute; waiting {} ms", model, limit.rpm(),
                    waitMillis);
                try {
                    sleeper.sleep(Duration.ofMillis(waitMillis));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new UsageTrackingException("Interrupted while waiting for the rate limit window of model "
                        + model, ex);
                }
            }
            long resumed = clock.millis();
            String resumedDay = dayKey(resumed);
            if (!resumedDay.equals(record.day())) {
                record = record.startDay(resumedDay);
            }
            record = record.startMinuteWindow(resumed);
        }

        ModelUsageRecord updated = record.increment();
        try {
            repository.upsert(updated);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to update Gemini model usage counters for {}", model, ex);
        }
    }

    /**
     * Creates a zero usage record for every model that has none. Existing records are left untouched.
     */
    public void sync(Collection<String> models) {
        if (models == null || models.isEmpty()) {
            return;
        }
        long now = clock.millis();
        String today = dayKey(now);
        try {
            int created = 0;
            for (String model : models) {
                if (repository.insertIfAbsent(ModelUsageRecord.empty(model, today, now))) {
                    created++;
                }
            }
            LOGGER.debug("Synchronised Gemini usage records for {} models ({} created)", models.size(), created);
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to sync Gemini model usage records", ex);
        }
    }

    public String dayKey(long epochMillis) {
        return DAY_KEY.format(Instant.ofEpochMilli(epochMillis).atZone(zone));
    }
}
