package com.e2eq.streamquery.coordinator;

import com.e2eq.streamquery.cache.CacheStore;
import com.e2eq.streamquery.exceptions.QueryExecutionException;
import com.e2eq.streamquery.exceptions.WaitTimeoutException;
import com.e2eq.streamquery.model.CacheEntry;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Waits for an execution running in another process by polling the cache store on a fixed
 * cadence. Gives up once the number of unsuccessful attempts exceeds
 * {@code ceil(timeout / pollInterval)}. No backoff.
 */
class CompletionPoller {

    private static final Logger LOG = Logger.getLogger(CompletionPoller.class);

    private final CacheStore cacheStore;
    private final ScheduledExecutorService scheduler;
    private final Duration pollInterval;

    CompletionPoller(CacheStore cacheStore, ScheduledExecutorService scheduler, Duration pollInterval) {
        this.cacheStore = cacheStore;
        this.scheduler = scheduler;
        this.pollInterval = pollInterval;
    }

    static int maxPollCount(long timeoutMs, long pollIntervalMs) {
        long interval = Math.max(1L, pollIntervalMs);
        return (int) Math.min(Integer.MAX_VALUE, (timeoutMs + interval - 1) / interval);
    }

    CompletableFuture<List<Object>> await(long fingerprint, long timeoutMs) {
        CompletableFuture<List<Object>> future = new CompletableFuture<>();
        int maxPoll = maxPollCount(timeoutMs, pollInterval.toMillis());
        attempt(fingerprint, future, maxPoll, 0);
        return future;
    }

    private void attempt(long fingerprint, CompletableFuture<List<Object>> future, int maxPoll, int pollCount) {
        if (future.isDone()) {
            return;
        }
        Optional<CacheEntry> entry;
        try {
            entry = cacheStore.getCompleted(fingerprint);
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
            return;
        }

        if (entry.isPresent()) {
            if (entry.get().isFailed()) {
                future.completeExceptionally(new QueryExecutionException(fingerprint,
                        "Execution of " + fingerprint + " failed in another process"));
            } else {
                LOG.debugf("Poll %d found completed result for %d", pollCount, fingerprint);
                future.complete(entry.get().getResult());
            }
            return;
        }

        int next = pollCount + 1;
        if (next > maxPoll) {
            future.completeExceptionally(new WaitTimeoutException(fingerprint, maxPoll));
            return;
        }
        try {
            scheduler.schedule(() -> attempt(fingerprint, future, maxPoll, next),
                    pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
    }
}
