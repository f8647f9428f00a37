package com.e2eq.streamquery.cache;

import com.e2eq.streamquery.model.CacheEntry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Shared, persistent coordination state keyed by query fingerprint. Every call is a round trip
 * to the backing store; implementations keep no local copy. Entries past their expiry are
 * purged by the store itself.
 */
public interface CacheStore {

    Optional<CacheEntry> get(long fingerprint);

    /**
     * Returns the entry only when it is no longer in progress (completed, or a failure marker).
     */
    Optional<CacheEntry> getCompleted(long fingerprint);

    /**
     * Atomically claims the fingerprint for a new execution: inserts an in-progress entry when
     * none exists or the existing one is a failure marker. When {@code replaceCompleted} is set a
     * completed entry is overwritten as well. An in-progress entry is never overwritten.
     *
     * @return true when the caller now owns the execution, false when it lost the race
     */
    boolean tryBeginInProgress(long fingerprint, boolean replaceCompleted);

    /**
     * Stores the result, clears the in-progress flag and refreshes the expiry.
     */
    void complete(long fingerprint, List<Object> result);

    void delete(long fingerprint);

    /**
     * Refreshes the expiry without touching anything else. No-op when the entry is gone.
     */
    void renewExpiry(long fingerprint);

    /**
     * Replaces the entry with a short lived failure marker so that waiting processes can stop
     * early.
     */
    void markFailed(long fingerprint, Duration ttl);
}
