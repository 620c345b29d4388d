package com.errorbuddy.store;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local counter store with lazy TTL expiry: an expired entry is
 * dropped the next time it is read, so no sweep is needed.
 */
public class InMemoryRateCounterStore implements RateCounterStore {

    private final Clock clock;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public InMemoryRateCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int get(String key) {
        Counter counter = live(key);
        return counter != null ? counter.value : 0;
    }

    @Override
    public void set(String key, int value, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            counters.remove(key);
            return;
        }
        long expiresAt = nowSeconds() + ttl.getSeconds();
        counters.put(key, new Counter(Math.max(0, value), expiresAt));
    }

    @Override
    public void delete(String key) {
        counters.remove(key);
    }

    @Override
    public long getExpiry(String key) {
        Counter counter = live(key);
        return counter != null ? counter.expiresAt : 0L;
    }

    @Override
    public String getStoreType() {
        return "in-memory";
    }

    private Counter live(String key) {
        Counter counter = counters.get(key);
        if (counter == null) {
            return null;
        }
        if (nowSeconds() >= counter.expiresAt) {
            counters.remove(key, counter);
            return null;
        }
        return counter;
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }

    private static final class Counter {
        private final int value;
        private final long expiresAt;

        private Counter(int value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
