package com.e2eq.streamquery.engine;

import com.e2eq.streamquery.model.OperationKind;
import com.e2eq.streamquery.model.RunningQuerySnapshot;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live bookkeeping for one execution running in this process. Counters are written by the
 * execution thread and read by introspection callers; the abort flag goes the other way.
 */
public class RunningQuery {

    private final long fingerprint;
    private final OperationKind operationKind;
    private final Map<String, Object> filter;
    private final Instant startedAt;
    private final Instant timesOutAt;
    private final AtomicLong processedDocuments = new AtomicLong();
    private final AtomicLong collectedResults = new AtomicLong();
    private final AtomicLong documentErrors = new AtomicLong();
    private final CompletableFuture<List<Object>> completion = new CompletableFuture<>();
    private volatile boolean abortRequested;

    public RunningQuery(long fingerprint, OperationKind operationKind, Map<String, Object> filter,
                        Instant startedAt, Instant timesOutAt) {
        this.fingerprint = fingerprint;
        this.operationKind = operationKind;
        this.filter = filter == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filter));
        this.startedAt = startedAt;
        this.timesOutAt = timesOutAt;
    }

    public long getFingerprint() {
        return fingerprint;
    }

    public OperationKind getOperationKind() {
        return operationKind;
    }

    public boolean isAbortRequested() {
        return abortRequested;
    }

    public void requestAbort() {
        abortRequested = true;
    }

    void documentScanned() {
        processedDocuments.incrementAndGet();
    }

    void documentFailed() {
        documentErrors.incrementAndGet();
    }

    void resultsCollected(long count) {
        collectedResults.set(count);
    }

    public long getProcessedDocuments() {
        return processedDocuments.get();
    }

    public long getDocumentErrors() {
        return documentErrors.get();
    }

    /**
     * Settles when the execution settles, with its result or its failure. Waiters in this
     * process attach here instead of polling the cache store.
     */
    public CompletableFuture<List<Object>> completion() {
        return completion;
    }

    public RunningQuerySnapshot snapshot() {
        return new RunningQuerySnapshot(fingerprint, operationKind, filter, startedAt, timesOutAt,
                processedDocuments.get(), collectedResults.get(), documentErrors.get(), abortRequested);
    }
}
