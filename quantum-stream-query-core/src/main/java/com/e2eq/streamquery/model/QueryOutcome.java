package com.e2eq.streamquery.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a query call answers with: the result sequence, or only the fingerprint when the caller
 * asked not to wait.
 */
@ToString
@EqualsAndHashCode
public final class QueryOutcome {

    private final long fingerprint;
    private final List<Object> results;
    private final boolean deferred;

    private QueryOutcome(long fingerprint, List<Object> results, boolean deferred) {
        this.fingerprint = fingerprint;
        this.results = results;
        this.deferred = deferred;
    }

    public static QueryOutcome completed(long fingerprint, List<Object> results) {
        List<Object> copy = results == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(results));
        return new QueryOutcome(fingerprint, copy, false);
    }

    public static QueryOutcome deferred(long fingerprint) {
        return new QueryOutcome(fingerprint, List.of(), true);
    }

    public long getFingerprint() {
        return fingerprint;
    }

    /**
     * Result sequence of a completed call; empty for a deferred one.
     */
    public List<Object> getResults() {
        return results;
    }

    public boolean isDeferred() {
        return deferred;
    }
}
