package com.e2eq.streamquery.engine;

import com.e2eq.streamquery.exceptions.QueryExecutionException;
import com.e2eq.streamquery.operation.ResultAccumulator;
import com.e2eq.streamquery.source.CursorRequest;
import com.e2eq.streamquery.source.DocumentCursor;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Streams the documents matching a query through a per-document operation.
 * <p>
 * The loop stops early, without failing, when an abort is requested, when the timeout fires or
 * when {@code limit} documents have been scanned; whatever was accumulated until then is the
 * result. Exceptions and errors thrown by the per-document operation are counted and skipped,
 * short of a VM failure. Only a failure of the cursor itself fails the execution.
 * </p>
 * <p>
 * The abort flag of the {@link RunningQuery} is mirrored into the loop's stop signal by a task
 * running every {@code abortSyncInterval}; that interval bounds how long an abort takes to be
 * seen. Both the timeout and an observed abort cancel the cursor so that a consumer blocked on a
 * page fetch is released.
 * </p>
 */
public class StreamingExecutionEngine {

    private static final Logger LOG = Logger.getLogger(StreamingExecutionEngine.class);

    private final ScheduledExecutorService scheduler;
    private final Duration abortSyncInterval;

    public StreamingExecutionEngine(ScheduledExecutorService scheduler, Duration abortSyncInterval) {
        this.scheduler = scheduler;
        this.abortSyncInterval = abortSyncInterval;
    }

    /**
     * Runs the execution on the calling thread and returns its result sequence.
     *
     * @throws QueryExecutionException when the cursor cannot be opened or breaks mid-stream
     */
    public List<Object> execute(ExecutionRequest request, RunningQuery running) {
        long fingerprint = request.fingerprint();
        long startT = System.currentTimeMillis();
        ResultAccumulator accumulator = new ResultAccumulator(request.operation().kind(), request.initialValue());
        StopSignal signal = new StopSignal();

        DocumentCursor cursor;
        try {
            cursor = request.source().open(new CursorRequest(request.filter(), request.readOptions(),
                    request.order(), request.batchSize()));
        } catch (RuntimeException e) {
            throw new QueryExecutionException(fingerprint,
                    "Failed to open cursor on " + request.source().name() + ": " + e.getMessage(), e);
        }

        ScheduledFuture<?> timeoutTask = scheduler.schedule(() -> {
            if (signal.stop(StopSignal.Reason.TIMED_OUT)) {
                LOG.debugf("Streaming query %d timeout reached after %d ms, cancelling cursor",
                        fingerprint, request.timeout().toMillis());
                cancelQuietly(cursor, fingerprint);
            }
        }, request.timeout().toMillis(), TimeUnit.MILLISECONDS);

        long syncMs = Math.max(1L, abortSyncInterval.toMillis());
        ScheduledFuture<?> abortSync = scheduler.scheduleWithFixedDelay(() -> {
            if (running.isAbortRequested() && signal.stop(StopSignal.Reason.ABORTED)) {
                LOG.debugf("Abort observed for streaming query %d, cancelling cursor", fingerprint);
                cancelQuietly(cursor, fingerprint);
            }
        }, syncMs, syncMs, TimeUnit.MILLISECONDS);

        try {
            consume(request, running, cursor, signal, accumulator);
        } finally {
            timeoutTask.cancel(false);
            abortSync.cancel(false);
            closeQuietly(cursor, fingerprint);
        }

        List<Object> result = accumulator.finish();
        if (LOG.isInfoEnabled()) {
            LOG.infof("Resolved streaming query %d after %d ms (%s). Processed %d documents, collected %d, %d document errors",
                    fingerprint, System.currentTimeMillis() - startT, describe(signal),
                    running.getProcessedDocuments(), accumulator.size(), running.getDocumentErrors());
        }
        return result;
    }

    private void consume(ExecutionRequest request, RunningQuery running, DocumentCursor cursor,
                         StopSignal signal, ResultAccumulator accumulator) {
        long fingerprint = request.fingerprint();
        Long limit = request.limit();
        long scanned = 0;

        while (true) {
            if (signal.isStopped()) {
                return;
            }
            if (limit != null && scanned >= limit) {
                return;
            }

            Map<String, Object> document;
            try {
                if (!cursor.hasNext()) {
                    return;
                }
                document = cursor.next();
            } catch (RuntimeException e) {
                if (signal.isStopped()) {
                    // the cursor was cancelled by us
                    return;
                }
                throw new QueryExecutionException(fingerprint,
                        "Streaming query failed with error: " + e.getMessage(), e);
            }

            if (signal.isStopped()) {
                return;
            }

            scanned++;
            running.documentScanned();
            try {
                request.operation().apply(accumulator, document);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (RuntimeException | Error e) {
                running.documentFailed();
                LOG.debugf("Error during execution of document operation for %d: %s", fingerprint, e.getMessage());
            }
            running.resultsCollected(accumulator.size());
        }
    }

    private static String describe(StopSignal signal) {
        switch (signal.reason()) {
            case ABORTED:
                return "aborted";
            case TIMED_OUT:
                return "timed out";
            default:
                return "completed";
        }
    }

    private static void cancelQuietly(DocumentCursor cursor, long fingerprint) {
        try {
            cursor.cancel();
        } catch (RuntimeException e) {
            LOG.debugf(e, "Cancelling cursor of %d failed", fingerprint);
        }
    }

    private static void closeQuietly(DocumentCursor cursor, long fingerprint) {
        try {
            cursor.close();
        } catch (RuntimeException e) {
            LOG.debugf(e, "Closing cursor of %d failed", fingerprint);
        }
    }
}
