package dev.invox.usage;

import java.util.Optional;

/**
 * Stores one {@link ModelUsageRecord} per model.
 */
public interface ModelUsageRepository {

    Optional<ModelUsageRecord> load(String model);

    void upsert(ModelUsageRecord record);

    /**
     * Stores {@code record} only when no record exists for its model.
     *
     * @return {@code true} when the record was created
     */
    boolean insertIfAbsent(ModelUsageRecord record);
}
