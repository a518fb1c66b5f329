package dev.invox.usage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps usage counters in memory. Used by the local profile and by tests.
 */
public class InMemoryModelUsageRepository implements ModelUsageRepository {

    private final Map<String, ModelUsageRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ModelUsageRecord> load(String model) {
        return Optional.ofNullable(records.get(model));
    }

    @Override
    public void upsert(ModelUsageRecord record) {
        records.put(record.model(), record);
    }

    @Override
    public boolean insertIfAbsent(ModelUsageRecord record) {
        return records.putIfAbsent(record.model(), record) == null;
    }
}
