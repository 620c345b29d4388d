package com.errorbuddy.store;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local signature store. Expiry is decided by the caller, not the store.
 */
public class InMemoryDedupStore implements DedupStore {

    private final Map<String, Long> tracked = new ConcurrentHashMap<>();

    @Override
    public Optional<Long> get(String signature) {
        return Optional.ofNullable(tracked.get(signature));
    }

    @Override
    public void set(String signature, long reportedAtEpochSeconds) {
        tracked.put(signature, reportedAtEpochSeconds);
    }

    @Override
    public Map<String, Long> getAll() {
        return new HashMap<>(tracked);
    }

    @Override
    public void delete(String signature) {
        tracked.remove(signature);
    }

    @Override
    public void deleteAll() {
        tracked.clear();
    }

    @Override
    public void deleteAll(Collection<String> signatures) {
        tracked.keySet().removeAll(signatures);
    }

    @Override
    public int size() {
        return tracked.size();
    }

    @Override
    public String getStoreType() {
        return "in-memory";
    }
}
