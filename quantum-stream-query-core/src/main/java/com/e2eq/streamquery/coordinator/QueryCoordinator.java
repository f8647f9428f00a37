package com.e2eq.streamquery.coordinator;

import com.e2eq.streamquery.cache.CacheStore;
import com.e2eq.streamquery.cache.QueryFingerprint;
import com.e2eq.streamquery.engine.ExecutionRegistry;
import com.e2eq.streamquery.engine.ExecutionRequest;
import com.e2eq.streamquery.engine.RunningQuery;
import com.e2eq.streamquery.engine.StreamingExecutionEngine;
import com.e2eq.streamquery.exceptions.QueryValidationException;
import com.e2eq.streamquery.exceptions.WaitTimeoutException;
import com.e2eq.streamquery.model.CacheEntry;
import com.e2eq.streamquery.model.QueryDescriptor;
import com.e2eq.streamquery.model.QueryOptions;
import com.e2eq.streamquery.model.QueryOutcome;
import com.e2eq.streamquery.model.RunningQuerySnapshot;
import com.e2eq.streamquery.operation.DocumentOperation;
import com.e2eq.streamquery.source.DocumentSource;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine. For every call it computes the query fingerprint and either serves
 * the cached result, waits for the execution already in flight, or admits and launches a new
 * streaming execution whose result it then writes back to the cache store.
 * <p>
 * Deduplication across processes is best effort: the cache store claim is atomic, but an entry
 * removed after a failure lets the next caller start over. Waiters in this process attach to the
 * running execution directly; waiters elsewhere poll the cache store.
 * </p>
 */
public class QueryCoordinator implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(QueryCoordinator.class);

    /** How many times a caller that lost the claim race re-reads the entry before waiting. */
    private static final int MAX_REDISPATCH = 2;

    private final CacheStore cacheStore;
    private final CoordinatorSettings settings;
    private final ExecutionRegistry registry = new ExecutionRegistry();
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final StreamingExecutionEngine engine;
    private final CompletionPoller poller;

    public QueryCoordinator(CacheStore cacheStore, CoordinatorSettings settings) {
        this.cacheStore = cacheStore;
        this.settings = settings;
        this.workers = Executors.newCachedThreadPool(daemonThreads("stream-query-worker"));
        this.scheduler = Executors.newScheduledThreadPool(1, daemonThreads("stream-query-timer"));
        this.engine = new StreamingExecutionEngine(scheduler, settings.getAbortSyncInterval());
        this.poller = new CompletionPoller(cacheStore, scheduler, settings.getPollInterval());
    }

    /**
     * Runs {@code operation} over the documents of {@code source} matching the descriptor, sharing
     * work with identical queries in flight and with cached results.
     *
     * Validation happens on the call. Everything else, cache store I/O included, happens once per
     * subscription to the returned Uni.
     *
     * @throws QueryValidationException synchronously, before any I/O, when an argument is malformed
     * @return the result sequence, or only the fingerprint when {@code options.dontAwait} is set;
     *         capacity, wait-timeout, execution and store failures are delivered through the Uni
     */
    public Uni<QueryOutcome> runAndResolve(DocumentSource source, QueryDescriptor descriptor,
                                           DocumentOperation operation, QueryOptions options) {
        validate(source, descriptor, operation, options);
        long fingerprint = QueryFingerprint.computeKey(descriptor);

        return Uni.createFrom().completionStage(() -> dispatch(fingerprint, source, descriptor, operation, options, 0))
                .onFailure(CompletionException.class).transform(QueryCoordinator::unwrap);
    }

    public long fingerprintOf(QueryDescriptor descriptor) {
        return QueryFingerprint.computeKey(descriptor);
    }

    public List<RunningQuerySnapshot> listRunningQueries() {
        return registry.snapshots();
    }

    /**
     * Flags the execution of {@code fingerprint} running in this process for abort. It stops at
     * the next document boundary and completes with what it has collected.
     *
     * @return true when a running execution was found
     */
    public boolean requestAbort(long fingerprint) {
        boolean found = registry.requestAbort(fingerprint);
        LOG.debugf("Abort requested for %d, running here: %s", fingerprint, Boolean.valueOf(found));
        return found;
    }

    public Optional<List<Object>> getCachedResult(long fingerprint) {
        return cacheStore.getCompleted(fingerprint)
                .filter(CacheEntry::isCompleted)
                .map(CacheEntry::getResult);
    }

    public void invalidate(long fingerprint) {
        cacheStore.delete(fingerprint);
    }

    @Override
    public void close() {
        workers.shutdownNow();
        scheduler.shutdownNow();
    }

    private CompletableFuture<QueryOutcome> dispatch(long fingerprint, DocumentSource source, QueryDescriptor descriptor,
                                                     DocumentOperation operation, QueryOptions options, int attempt) {
        CacheEntry entry = cacheStore.get(fingerprint).orElse(null);

        // serve straight from cache and extend the entry's lifetime
        if (entry != null && entry.isCompleted() && !options.isNoCache()) {
            if (options.isDontAwait()) {
                LOG.debugf("Will not return cache entry, resolving asap %d", fingerprint);
                return CompletableFuture.completedFuture(QueryOutcome.deferred(fingerprint));
            }
            LOG.debugf("Serving query straight away from cached result %d", fingerprint);
            cacheStore.renewExpiry(fingerprint);
            return CompletableFuture.completedFuture(QueryOutcome.completed(fingerprint, entry.getResult()));
        }

        if (entry != null && entry.isInProgress()) {
            return awaitInFlight(fingerprint, options);
        }

        // absent, failed, or completed but bypassed: start a new execution
        LOG.debugf("Query %d not cached and not in progress, starting new process (%d running)",
                fingerprint, registry.size());
        return launch(fingerprint, source, descriptor, operation, options, attempt);
    }

    private CompletableFuture<QueryOutcome> awaitInFlight(long fingerprint, QueryOptions options) {
        if (options.isDontAwait()) {
            LOG.debugf("Will not await, therefore resolving asap %d", fingerprint);
            return CompletableFuture.completedFuture(QueryOutcome.deferred(fingerprint));
        }

        Optional<RunningQuery> local = registry.find(fingerprint);
        if (local.isPresent()) {
            LOG.debugf("Query %d is running in this process, attaching to it", fingerprint);
            return local.get().completion()
                    .thenApply(result -> QueryOutcome.completed(fingerprint, result))
                    .orTimeout(options.getTimeoutMs(), TimeUnit.MILLISECONDS)
                    .exceptionally(error -> {
                        Throwable cause = unwrap(error);
                        if (cause instanceof TimeoutException) {
                            throw new WaitTimeoutException(fingerprint,
                                    CompletionPoller.maxPollCount(options.getTimeoutMs(), settings.getPollInterval().toMillis()));
                        }
                        throw cause instanceof RuntimeException ? (RuntimeException) cause : new CompletionException(cause);
                    });
        }

        LOG.debugf("Another process is already working on query %d, awaiting its result", fingerprint);
        return poller.await(fingerprint, options.getTimeoutMs())
                .thenApply(result -> QueryOutcome.completed(fingerprint, result));
    }

    private CompletableFuture<QueryOutcome> launch(long fingerprint, DocumentSource source, QueryDescriptor descriptor,
                                                   DocumentOperation operation, QueryOptions options, int attempt) {
        Instant now = Instant.now();
        RunningQuery running = new RunningQuery(fingerprint, descriptor.getOperationKind(), descriptor.getFilter(),
                now, now.plusMillis(options.getTimeoutMs()));

        if (!registry.admit(running, settings.getMaxParallelProcesses())) {
            return awaitInFlight(fingerprint, options);
        }

        // from here on local callers may already be attached to running.completion()
        boolean owner;
        try {
            owner = cacheStore.tryBeginInProgress(fingerprint, options.isNoCache());
        } catch (RuntimeException e) {
            registry.deregister(running);
            running.completion().completeExceptionally(e);
            throw e;
        }
        if (!owner) {
            registry.deregister(running);
            LOG.debugf("Lost the claim on %d to another process", fingerprint);
            return handOver(running, source, descriptor, operation, options, attempt);
        }

        ExecutionRequest request = new ExecutionRequest(fingerprint, source, descriptor.getFilter(),
                descriptor.getReadOptions(), operation, options.getInitialValue(), options.getBatchSize(),
                descriptor.getOrder(), Duration.ofMillis(options.getTimeoutMs()), descriptor.getLimit());

        try {
            workers.execute(() -> runExecution(request, running, options.isDontAwait()));
        } catch (RejectedExecutionException e) {
            registry.deregister(running);
            discardEntry(fingerprint, e);
            running.completion().completeExceptionally(e);
            throw e;
        }

        if (options.isDontAwait()) {
            return CompletableFuture.completedFuture(QueryOutcome.deferred(fingerprint));
        }
        return running.completion().thenApply(result -> QueryOutcome.completed(fingerprint, result));
    }

    /**
     * Continues a call whose claim was lost after its record had been registered. Callers that
     * attached to the record in the meantime are settled with whatever the continuation yields.
     */
    private CompletableFuture<QueryOutcome> handOver(RunningQuery running, DocumentSource source, QueryDescriptor descriptor,
                                                     DocumentOperation operation, QueryOptions options, int attempt) {
        long fingerprint = running.getFingerprint();
        CompletableFuture<QueryOutcome> next;
        try {
            next = attempt < MAX_REDISPATCH
                    ? dispatch(fingerprint, source, descriptor, operation, options, attempt + 1)
                    : awaitInFlight(fingerprint, options);
        } catch (RuntimeException e) {
            running.completion().completeExceptionally(e);
            throw e;
        }

        // a deferred outcome carries no result, attached callers wait on the store instead
        CompletableFuture<List<Object>> results = options.isDontAwait()
                ? poller.await(fingerprint, options.getTimeoutMs())
                : next.thenApply(QueryOutcome::getResults);
        results.whenComplete((result, error) -> {
            if (error != null) {
                running.completion().completeExceptionally(unwrap(error));
            } else {
                running.completion().complete(result);
            }
        });
        return next;
    }

    private void runExecution(ExecutionRequest request, RunningQuery running, boolean unawaited) {
        long fingerprint = request.fingerprint();
        List<Object> result;
        try {
            result = engine.execute(request, running);
            cacheStore.complete(fingerprint, result);
        } catch (Throwable e) {
            discardEntry(fingerprint, e);
            registry.deregister(running);
            if (unawaited) {
                LOG.warnf(e, "Error on unawaited streaming process %d: %s", fingerprint, e.getMessage());
            } else {
                LOG.debugf("Streaming process %d failed: %s", fingerprint, e.getMessage());
            }
            running.completion().completeExceptionally(e);
            if (e instanceof VirtualMachineError) {
                throw (VirtualMachineError) e;
            }
            return;
        }
        registry.deregister(running);
        running.completion().complete(result);
    }

    private void discardEntry(long fingerprint, Throwable failure) {
        try {
            if (settings.getFailureMarkerTtl().isZero() || settings.getFailureMarkerTtl().isNegative()) {
                cacheStore.delete(fingerprint);
            } else {
                cacheStore.markFailed(fingerprint, settings.getFailureMarkerTtl());
            }
        } catch (RuntimeException cleanup) {
            LOG.warnf("Failed to clear cache entry of %d after execution failure: %s", fingerprint, cleanup.getMessage());
            failure.addSuppressed(cleanup);
        }
    }

    private static void validate(DocumentSource source, QueryDescriptor descriptor,
                                 DocumentOperation operation, QueryOptions options) {
        if (source == null) {
            throw new QueryValidationException("source", "please pass a valid document source");
        }
        if (descriptor == null) {
            throw new QueryValidationException("descriptor", "please pass a query descriptor");
        }
        if (descriptor.getFilter() == null) {
            throw new QueryValidationException("filter", "please pass a valid filter mapping");
        }
        if (descriptor.getReadOptions() == null) {
            throw new QueryValidationException("readOptions", "please pass a valid read options mapping");
        }
        if (descriptor.getOperationKind() == null) {
            throw new QueryValidationException("operationKind", "please pass one of resolve, filter, reduce, map");
        }
        if (descriptor.getOrder() == null) {
            throw new QueryValidationException("order", "please pass a sort order");
        }
        if (descriptor.getLimit() != null && descriptor.getLimit() < 0) {
            throw new QueryValidationException("limit", "must not be negative but was " + descriptor.getLimit());
        }
        if (operation == null) {
            throw new QueryValidationException("operation", "please pass a document operation");
        }
        if (operation.kind() != descriptor.getOperationKind()) {
            throw new QueryValidationException("operation", String.format(
                    "a %s operation cannot run as %s", operation.kind().label(), descriptor.getOperationKind().label()));
        }
        if (options == null) {
            throw new QueryValidationException("options", "please pass query options");
        }
        if (options.getBatchSize() <= 0) {
            throw new QueryValidationException("batchSize", "must be positive but was " + options.getBatchSize());
        }
        if (options.getTimeoutMs() <= 0) {
            throw new QueryValidationException("timeoutMs", "must be positive but was " + options.getTimeoutMs());
        }
        source.validateReadOptions(descriptor.getReadOptions());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread th = new Thread(r, prefix + "-" + counter.incrementAndGet());
            th.setDaemon(true);
            return th;
        };
    }
}
