package com.e2eq.streamquery.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Caller supplied options for a single query. Defaults match the behaviour of a call that passes
 * no options at all.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class QueryOptions {

    public static final int DEFAULT_BATCH_SIZE = 512;
    public static final long DEFAULT_TIMEOUT_MS = 60L * 1000L * 3L;

    /** Projection and other query shaping options handed to the document source. */
    @Builder.Default
    private final Map<String, Object> readOptions = Map.of();

    @Builder.Default
    private final int batchSize = DEFAULT_BATCH_SIZE;

    @Builder.Default
    private final SortOrder order = SortOrder.DESCENDING;

    @Builder.Default
    private final long timeoutMs = DEFAULT_TIMEOUT_MS;

    /** Fire-and-forget: answer with the fingerprint only and let the execution run on. */
    @Builder.Default
    private final boolean dontAwait = false;

    /** Skip the completed-result short circuit. In-progress work is still shared. */
    @Builder.Default
    private final boolean noCache = false;

    /** Starting accumulator, only used by reduce. */
    private final Object initialValue;

    /** Maximum number of documents to scan, {@code null} for no limit. */
    private final Long limit;

    /** Optional name folded into the fingerprint to keep different document functions apart. */
    private final String operationName;

    public static QueryOptions defaults() {
        return QueryOptions.builder().build();
    }
}
