package com.e2eq.streamquery.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persisted coordination state of one fingerprint. An entry that is in progress never carries a
 * result.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CacheEntry {

    private final long fingerprint;
    private final boolean inProgress;
    private final boolean failed;
    private final List<Object> result;
    private final Instant expiresAt;

    private CacheEntry(long fingerprint, boolean inProgress, boolean failed, List<Object> result, Instant expiresAt) {
        this.fingerprint = fingerprint;
        this.inProgress = inProgress;
        this.failed = failed;
        this.result = result;
        this.expiresAt = expiresAt;
    }

    public static CacheEntry inProgress(long fingerprint, Instant expiresAt) {
        return new CacheEntry(fingerprint, true, false, null, expiresAt);
    }

    public static CacheEntry completed(long fingerprint, List<Object> result, Instant expiresAt) {
        List<Object> copy = result == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(result));
        return new CacheEntry(fingerprint, false, false, copy, expiresAt);
    }

    public static CacheEntry failed(long fingerprint, Instant expiresAt) {
        return new CacheEntry(fingerprint, false, true, null, expiresAt);
    }

    /**
     * True when the entry holds a usable result.
     */
    public boolean isCompleted() {
        return !inProgress && !failed;
    }

    public CacheEntry withExpiresAt(Instant newExpiresAt) {
        return new CacheEntry(fingerprint, inProgress, failed, result, newExpiresAt);
    }
}
