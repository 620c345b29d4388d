package com.errorbuddy.store;

import java.time.Duration;

/**
 * Integer counters that expire on their own.
 * Implementations signal failures with {@link StoreException}.
 */
public interface RateCounterStore {

    /**
     * @return the stored value, or 0 when absent or expired
     */
    int get(String key);

    void set(String key, int value, Duration ttl);

    void delete(String key);

    /**
     * @return expiry as epoch seconds, or 0 when absent or expired
     */
    long getExpiry(String key);

    String getStoreType();
}
