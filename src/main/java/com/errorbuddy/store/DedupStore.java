package com.errorbuddy.store;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store of tracked error signatures.
 * Values are the epoch seconds at which the signature was last reported.
 * Implementations signal failures with {@link StoreException}.
 */
public interface DedupStore {

    Optional<Long> get(String signature);

    void set(String signature, long reportedAtEpochSeconds);

    /**
     * Snapshot of every tracked signature.
     */
    Map<String, Long> getAll();

    void delete(String signature);

    void deleteAll();

    /**
     * Removes the given signatures in one operation. Unknown signatures are ignored.
     */
    void deleteAll(Collection<String> signatures);

    int size();

    String getStoreType();
}
