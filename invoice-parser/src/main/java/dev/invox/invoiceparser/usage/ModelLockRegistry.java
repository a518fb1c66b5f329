package dev.invox.invoiceparser.usage;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out one lock per model name so that usage updates for a model are serialised while different models
 * proceed independently. Locks are never removed; the key space is the catalog's model list.
 */
public class ModelLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String model) {
        return locks.computeIfAbsent(model, key -> new ReentrantLock(true));
    }

    int size() {
        return locks.size();
    }
}
