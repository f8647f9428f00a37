package com.e2eq.streamquery.coordinator;

import com.e2eq.streamquery.cache.InMemoryCacheStoreTestDouble;
import com.e2eq.streamquery.exceptions.CapacityExceededException;
import com.e2eq.streamquery.exceptions.QueryExecutionException;
import com.e2eq.streamquery.exceptions.QueryValidationException;
import com.e2eq.streamquery.exceptions.WaitTimeoutException;
import com.e2eq.streamquery.model.CacheEntry;
import com.e2eq.streamquery.model.OperationKind;
import com.e2eq.streamquery.model.QueryDescriptor;
import com.e2eq.streamquery.model.QueryOptions;
import com.e2eq.streamquery.model.QueryOutcome;
import com.e2eq.streamquery.model.RunningQuerySnapshot;
import com.e2eq.streamquery.operation.DocumentOperation;
import com.e2eq.streamquery.operation.Resolution;
import com.e2eq.streamquery.source.CursorRequest;
import com.e2eq.streamquery.source.DocumentCursor;
import com.e2eq.streamquery.source.InMemoryDocumentSourceTestDouble;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class QueryCoordinatorTest {

    private static final Duration AWAIT = Duration.ofSeconds(10);

    private InMemoryCacheStoreTestDouble cacheStore;
    private QueryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        cacheStore = new InMemoryCacheStoreTestDouble();
        coordinator = new QueryCoordinator(cacheStore, settings().build());
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    private static CoordinatorSettings.CoordinatorSettingsBuilder settings() {
        return CoordinatorSettings.builder()
                .pollInterval(Duration.ofMillis(20))
                .abortSyncInterval(Duration.ofMillis(5))
                .maxParallelProcesses(4);
    }

    private static InMemoryDocumentSourceTestDouble people() {
        return new InMemoryDocumentSourceTestDouble("people")
                .add(Map.of("_id", 1, "firstName", "Chanti", "surName", "Chris"))
                .add(Map.of("_id", 2, "firstName", "Chris", "surName", "Chanti"));
    }

    private static DocumentOperation surName() {
        return DocumentOperation.resolve(doc -> Resolution.keep(doc.get("surName")));
    }

    private static Map<String, Object> firstNameMatching(String regex) {
        return Map.of("firstName", Map.of("$regex", regex));
    }

    private Uni<QueryOutcome> resolve(InMemoryDocumentSourceTestDouble source, Map<String, Object> filter, QueryOptions options) {
        return coordinator.runAndResolve(source, QueryDescriptor.of(source.name(), filter, OperationKind.RESOLVE, options),
                surName(), options);
    }

    private Uni<QueryOutcome> mapNumbers(InMemoryDocumentSourceTestDouble source, QueryOptions options) {
        return coordinator.runAndResolve(source, QueryDescriptor.of(source.name(), Map.of(), OperationKind.MAP, options),
                DocumentOperation.map(doc -> doc.get("n")), options);
    }

    private long fingerprint(InMemoryDocumentSourceTestDouble source, Map<String, Object> filter, OperationKind kind, QueryOptions options) {
        return coordinator.fingerprintOf(QueryDescriptor.of(source.name(), filter, kind, options));
    }

    private static QueryOutcome join(CompletableFuture<QueryOutcome> call) throws Exception {
        try {
            return call.get(AWAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + AWAIT.toMillis();
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met in time");
            }
            Thread.sleep(5);
        }
    }

    @Test
    void testResolveEndToEndServesSecondShapeFromCache() {
        InMemoryDocumentSourceTestDouble source = people();
        QueryOptions options = QueryOptions.defaults();

        QueryOutcome first = resolve(source, firstNameMatching("Chris"), options).await().atMost(AWAIT);
        assertFalse(first.isDeferred());
        assertEquals(List.of("Chanti"), first.getResults());

        // same field names, different value: same fingerprint, cached answer
        QueryOutcome second = resolve(source, firstNameMatching("Chanti"), options).await().atMost(AWAIT);
        assertEquals(first.getFingerprint(), second.getFingerprint());
        assertEquals(List.of("Chanti"), second.getResults());
        assertEquals(1, source.getOpenCount());
        assertEquals(1, cacheStore.getRenewals());

        coordinator.invalidate(first.getFingerprint());
        QueryOutcome third = resolve(source, firstNameMatching("Chanti"), options).await().atMost(AWAIT);
        assertEquals(List.of("Chris"), third.getResults());
        assertEquals(2, source.getOpenCount());
    }

    @Test
    void testCompletedExecutionIsStoredAndDeregistered() {
        InMemoryDocumentSourceTestDouble source = people();
        QueryOutcome outcome = resolve(source, firstNameMatching("Chris"), QueryOptions.defaults()).await().atMost(AWAIT);

        CacheEntry entry = cacheStore.peek(outcome.getFingerprint()).orElseThrow();
        assertTrue(entry.isCompleted());
        assertEquals(List.of("Chanti"), entry.getResult());
        assertTrue(coordinator.listRunningQueries().isEmpty());
        assertEquals(List.of("Chanti"), coordinator.getCachedResult(outcome.getFingerprint()).orElseThrow());
    }

    @Test
    void testDontAwaitReturnsFingerprintAndKeepsRunning() throws Exception {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(20).delayPerDocument(5);
        QueryOptions options = QueryOptions.builder().dontAwait(true).build();

        QueryOutcome outcome = mapNumbers(source, options).await().atMost(AWAIT);

        assertTrue(outcome.isDeferred());
        assertTrue(outcome.getResults().isEmpty());
        assertEquals(fingerprint(source, Map.of(), OperationKind.MAP, options), outcome.getFingerprint());
        assertFalse(coordinator.listRunningQueries().isEmpty());

        waitUntil(() -> coordinator.getCachedResult(outcome.getFingerprint()).isPresent());
        assertEquals(20, coordinator.getCachedResult(outcome.getFingerprint()).orElseThrow().size());
        waitUntil(() -> coordinator.listRunningQueries().isEmpty());
    }

    @Test
    void testDontAwaitOnCachedEntrySkipsResult() {
        InMemoryDocumentSourceTestDouble source = people();
        QueryOutcome first = resolve(source, firstNameMatching("Chris"), QueryOptions.defaults()).await().atMost(AWAIT);

        QueryOutcome second = resolve(source, firstNameMatching("Chris"), QueryOptions.builder().dontAwait(true).build())
                .await().atMost(AWAIT);

        assertTrue(second.isDeferred());
        assertEquals(first.getFingerprint(), second.getFingerprint());
        assertEquals(0, cacheStore.getRenewals());
    }

    @Test
    void testConcurrentIdenticalCallsShareOneExecution() throws Exception {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(30).delayPerDocument(3);
        QueryOptions options = QueryOptions.defaults();
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<QueryOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return mapNumbers(source, options).await().atMost(AWAIT);
                }));
            }
            start.countDown();

            List<Object> expected = null;
            for (Future<QueryOutcome> future : futures) {
                QueryOutcome outcome = future.get();
                assertEquals(30, outcome.getResults().size());
                if (expected == null) {
                    expected = outcome.getResults();
                }
                assertEquals(expected, outcome.getResults());
            }
            assertEquals(1, source.getOpenCount(), "Exactly one streaming execution should have run");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testDontAwaitWhileInProgressReturnsFingerprint() throws Exception {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(50).delayPerDocument(5);
        QueryOutcome running = mapNumbers(source, QueryOptions.builder().dontAwait(true).build()).await().atMost(AWAIT);
        waitUntil(() -> source.getOpenCount() == 1);

        QueryOutcome second = mapNumbers(source, QueryOptions.builder().dontAwait(true).build()).await().atMost(AWAIT);

        assertTrue(second.isDeferred());
        assertEquals(running.getFingerprint(), second.getFingerprint());
        assertEquals(1, source.getOpenCount());
        coordinator.requestAbort(running.getFingerprint());
        waitUntil(() -> coordinator.listRunningQueries().isEmpty());
    }

    @Test
    void testSecondCallerInProcessAttachesToRunningExecution() throws Exception {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(40).delayPerDocument(5);
        CompletableFuture<QueryOutcome> first = mapNumbers(source, QueryOptions.defaults()).subscribeAsCompletionStage();
        waitUntil(() -> !coordinator.listRunningQueries().isEmpty());

        QueryOutcome second = mapNumbers(source, QueryOptions.defaults()).await().atMost(AWAIT);

        assertEquals(40, second.getResults().size());
        assertEquals(join(first).getResults(), second.getResults());
        assertEquals(1, source.getOpenCount());
    }

    @Test
    void testAttachedWaiterTimesOutWithoutHurtingExecution() throws Exception {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(40).delayPerDocument(10);
        CompletableFuture<QueryOutcome> first = mapNumbers(source, QueryOptions.defaults()).subscribeAsCompletionStage();
        waitUntil(() -> !coordinator.listRunningQueries().isEmpty());

        Uni<QueryOutcome> impatient = mapNumbers(source, QueryOptions.builder().timeoutMs(50).build());

        assertThrows(WaitTimeoutException.class, () -> impatient.await().atMost(AWAIT));
        assertEquals(40, join(first).getResults().size());
    }

    @Test
    void testInvalidateTriggersFreshExecution() {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(5);
        QueryOutcome first = mapNumbers(source, QueryOptions.defaults()).await().atMost(AWAIT);

        coordinator.invalidate(first.getFingerprint());
        assertTrue(coordinator.getCachedResult(first.getFingerprint()).isEmpty());

        mapNumbers(source, QueryOptions.defaults()).await().atMost(AWAIT);
        assertEquals(2, source.getOpenCount());
    }

    @Test
    void testNoCacheBypassesCompletedEntry() {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(5);
        mapNumbers(source, QueryOptions.defaults()).await().atMost(AWAIT);

        QueryOutcome fresh = mapNumbers(source, QueryOptions.builder().noCache(true).build()).await().atMost(AWAIT);

        assertEquals(5, fresh.getResults().size());
        assertEquals(2, source.getOpenCount());
    }

    @Test
    void testNoCacheStillSharesInProgressWork() throws Exception {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(30).delayPerDocument(5);
        CompletableFuture<QueryOutcome> first = mapNumbers(source, QueryOptions.defaults()).subscribeAsCompletionStage();
        waitUntil(() -> !coordinator.listRunningQueries().isEmpty());

        QueryOutcome second = mapNumbers(source, QueryOptions.builder().noCache(true).build()).await().atMost(AWAIT);

        assertEquals(30, second.getResults().size());
        assertEquals(1, source.getOpenCount());
        join(first);
    }

    @Test
    void testCapacityErrorWhenLimitReached() throws Exception {
        coordinator.close();
        coordinator = new QueryCoordinator(cacheStore, settings().maxParallelProcesses(1).build());
        InMemoryDocumentSourceTestDouble slow = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(500).delayPerDocument(5);
        InMemoryDocumentSourceTestDouble other = people();

        QueryOutcome running = mapNumbers(slow, QueryOptions.builder().dontAwait(true).build()).await().atMost(AWAIT);
        long rejected = fingerprint(other, firstNameMatching("Chris"), OperationKind.RESOLVE, QueryOptions.defaults());

        CapacityExceededException e = assertThrows(CapacityExceededException.class,
                () -> resolve(other, firstNameMatching("Chris"), QueryOptions.defaults()).await().atMost(AWAIT));
        assertEquals(rejected, e.getFingerprint());
        assertEquals(0, other.getOpenCount());
        assertTrue(cacheStore.peek(rejected).isEmpty(), "A rejected call must not leave an entry behind");

        assertTrue(coordinator.requestAbort(running.getFingerprint()));
        waitUntil(() -> coordinator.listRunningQueries().isEmpty());
        assertEquals(List.of("Chanti"), resolve(other, firstNameMatching("Chris"), QueryOptions.defaults()).await().atMost(AWAIT).getResults());
    }

    @Test
    void testExecutionFailureDeletesEntryAndAllowsRetry() {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(10).failAfter(2);
        long fp = fingerprint(source, Map.of(), OperationKind.MAP, QueryOptions.defaults());

        assertThrows(QueryExecutionException.class, () -> mapNumbers(source, QueryOptions.defaults()).await().atMost(AWAIT));

        assertTrue(cacheStore.peek(fp).isEmpty());
        assertTrue(coordinator.listRunningQueries().isEmpty());

        assertThrows(QueryExecutionException.class, () -> mapNumbers(source, QueryOptions.defaults()).await().atMost(AWAIT));
        assertEquals(2, source.getOpenCount(), "A failed fingerprint is retried by the next call");
    }

    @Test
    void testErrorInDocumentOperationKeepsExecutionSlotFree() throws Exception {
        coordinator.close();
        coordinator = new QueryCoordinator(cacheStore, settings().maxParallelProcesses(1).build());
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(4);
        QueryOptions options = QueryOptions.defaults();
        DocumentOperation strict = DocumentOperation.map(doc -> {
            if (Integer.valueOf(2).equals(doc.get("n"))) {
                throw new AssertionError("two is not allowed");
            }
            return doc.get("n");
        });

        QueryOutcome outcome = coordinator.runAndResolve(source,
                QueryDescriptor.of(source.name(), Map.of(), OperationKind.MAP, options), strict, options).await().atMost(AWAIT);

        assertEquals(List.of(4, 3, 1), outcome.getResults());
        assertTrue(coordinator.listRunningQueries().isEmpty());
        assertEquals(List.of("Chanti"), resolve(people(), firstNameMatching("Chris"), options).await().atMost(AWAIT).getResults());
    }

    @Test
    void testErrorOpeningSourceFailsCallerAndFreesSlot() throws Exception {
        coordinator.close();
        coordinator = new QueryCoordinator(cacheStore, settings().maxParallelProcesses(1).build());
        InMemoryDocumentSourceTestDouble broken = new InMemoryDocumentSourceTestDouble("numbers") {
            @Override
            public DocumentCursor open(CursorRequest request) {
                super.open(request);
                throw new NoClassDefFoundError("com/example/MissingDriver");
            }
        }.addNumbered(3);
        long fp = fingerprint(broken, Map.of(), OperationKind.MAP, QueryOptions.defaults());

        CompletableFuture<QueryOutcome> call = mapNumbers(broken, QueryOptions.defaults()).subscribeAsCompletionStage();

        ExecutionException e = assertThrows(ExecutionException.class, () -> call.get(AWAIT.toMillis(), TimeUnit.MILLISECONDS));
        assertInstanceOf(NoClassDefFoundError.class, e.getCause());
        assertTrue(cacheStore.peek(fp).isEmpty());
        assertTrue(coordinator.listRunningQueries().isEmpty());
        assertEquals(List.of("Chanti"), resolve(people(), firstNameMatching("Chris"), QueryOptions.defaults()).await().atMost(AWAIT).getResults());
    }

    @Test
    void testCallerAttachedDuringLostClaimGetsWinnersResult() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean firstClaim = new AtomicBoolean(true);
        InMemoryCacheStoreTestDouble racing = new InMemoryCacheStoreTestDouble() {
            @Override
            public boolean tryBeginInProgress(long fingerprint, boolean replaceCompleted) {
                if (!firstClaim.compareAndSet(true, false)) {
                    return super.tryBeginInProgress(fingerprint, replaceCompleted);
                }
                try {
                    release.await(AWAIT.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                // another process claimed the fingerprint and finished first
                put(CacheEntry.completed(fingerprint, List.of("remote"), Instant.now().plusSeconds(60)));
                return false;
            }
        };
        coordinator.close();
        coordinator = new QueryCoordinator(racing, settings().build());
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(5);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<QueryOutcome> claimer = pool.submit(() -> mapNumbers(source, QueryOptions.defaults()).await().atMost(AWAIT));
            waitUntil(() -> !coordinator.listRunningQueries().isEmpty());

            CompletableFuture<QueryOutcome> attached = mapNumbers(source, QueryOptions.defaults()).subscribeAsCompletionStage();
            assertFalse(attached.isDone());
            release.countDown();

            assertEquals(List.of("remote"), claimer.get(AWAIT.toMillis(), TimeUnit.MILLISECONDS).getResults());
            assertEquals(List.of("remote"), join(attached).getResults());
            assertEquals(0, source.getOpenCount());
            assertTrue(coordinator.listRunningQueries().isEmpty());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void testNothingRunsUntilSubscribed() throws Exception {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(3);
        QueryOptions options = QueryOptions.builder().noCache(true).build();
        Uni<QueryOutcome> call = mapNumbers(source, options);

        Thread.sleep(50);
        assertEquals(0, source.getOpenCount());
        assertTrue(cacheStore.peek(fingerprint(source, Map.of(), OperationKind.MAP, options)).isEmpty());

        assertEquals(3, call.await().atMost(AWAIT).getResults().size());
        assertEquals(3, call.await().atMost(AWAIT).getResults().size());
        assertEquals(2, source.getOpenCount(), "Each subscription dispatches anew");
    }

    @Test
    void testCacheWriteFailureIsPropagatedAndEntryRemoved() {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(3);
        cacheStore.setFailCompletes(true);
        long fp = fingerprint(source, Map.of(), OperationKind.MAP, QueryOptions.defaults());

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> mapNumbers(source, QueryOptions.defaults()).await().atMost(AWAIT));

        assertEquals("cache store unavailable", e.getMessage());
        assertTrue(cacheStore.peek(fp).isEmpty());
        assertEquals(1, cacheStore.getDeletes());
    }

    @Test
    void testWaitsForExecutionInAnotherProcess() throws Exception {
        InMemoryDocumentSourceTestDouble source = people();
        long fp = fingerprint(source, firstNameMatching("Chris"), OperationKind.RESOLVE, QueryOptions.defaults());
        cacheStore.put(CacheEntry.inProgress(fp, Instant.now().plusSeconds(60)));

        CompletableFuture<QueryOutcome> waiting = resolve(source, firstNameMatching("Chris"), QueryOptions.defaults())
                .subscribeAsCompletionStage();
        Thread.sleep(100);
        cacheStore.complete(fp, List.of("remote"));

        assertEquals(List.of("remote"), join(waiting).getResults());
        assertEquals(0, source.getOpenCount());
    }

    @Test
    void testPollingGivesUpAfterTimeout() {
        InMemoryDocumentSourceTestDouble source = people();
        QueryOptions options = QueryOptions.builder().timeoutMs(100).build();
        long fp = fingerprint(source, firstNameMatching("Chris"), OperationKind.RESOLVE, options);
        cacheStore.put(CacheEntry.inProgress(fp, Instant.now().plusSeconds(60)));

        WaitTimeoutException e = assertThrows(WaitTimeoutException.class,
                () -> resolve(source, firstNameMatching("Chris"), options).await().atMost(AWAIT));

        assertEquals(fp, e.getFingerprint());
        assertEquals(5, e.getAttempts());
        assertTrue(cacheStore.peek(fp).orElseThrow().isInProgress(), "The other execution's entry is untouched");
    }

    @Test
    void testFailureMarkerStopsPollersEarly() throws Exception {
        coordinator.close();
        coordinator = new QueryCoordinator(cacheStore, settings().failureMarkerTtl(Duration.ofSeconds(5)).build());
        InMemoryDocumentSourceTestDouble source = people();
        long fp = fingerprint(source, firstNameMatching("Chris"), OperationKind.RESOLVE, QueryOptions.defaults());
        cacheStore.put(CacheEntry.inProgress(fp, Instant.now().plusSeconds(60)));

        CompletableFuture<QueryOutcome> waiting = resolve(source, firstNameMatching("Chris"), QueryOptions.defaults())
                .subscribeAsCompletionStage();
        Thread.sleep(60);
        cacheStore.markFailed(fp, Duration.ofSeconds(5));

        long start = System.currentTimeMillis();
        assertThrows(QueryExecutionException.class, () -> join(waiting));
        assertTrue(System.currentTimeMillis() - start < 2_000);

        // a failure marker does not block new work
        assertEquals(List.of("Chanti"), resolve(source, firstNameMatching("Chris"), QueryOptions.defaults()).await().atMost(AWAIT).getResults());
    }

    @Test
    void testLocalFailureLeavesMarkerWhenConfigured() {
        coordinator.close();
        coordinator = new QueryCoordinator(cacheStore, settings().failureMarkerTtl(Duration.ofSeconds(5)).build());
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(10).failAfter(1);
        long fp = fingerprint(source, Map.of(), OperationKind.MAP, QueryOptions.defaults());

        assertThrows(QueryExecutionException.class, () -> mapNumbers(source, QueryOptions.defaults()).await().atMost(AWAIT));

        assertTrue(cacheStore.peek(fp).orElseThrow().isFailed());
        assertTrue(coordinator.getCachedResult(fp).isEmpty());
    }

    @Test
    void testAbortCompletesWithPartialResult() throws Exception {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(300).delayPerDocument(5);
        CompletableFuture<QueryOutcome> call = mapNumbers(source, QueryOptions.defaults()).subscribeAsCompletionStage();
        waitUntil(() -> coordinator.listRunningQueries().stream().anyMatch(q -> q.processedDocuments() >= 3));
        RunningQuerySnapshot snapshot = coordinator.listRunningQueries().get(0);
        assertEquals(OperationKind.MAP, snapshot.operationKind());

        assertTrue(coordinator.requestAbort(snapshot.fingerprint()));
        QueryOutcome outcome = join(call);

        assertTrue(outcome.getResults().size() >= 3 && outcome.getResults().size() < 300);
        assertEquals(outcome.getResults(), coordinator.getCachedResult(outcome.getFingerprint()).orElseThrow());
        assertFalse(coordinator.requestAbort(snapshot.fingerprint()), "Nothing left to abort");
    }

    @Test
    void testTimeoutCompletesWithPartialResult() {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(100).delayPerDocument(10);

        QueryOutcome outcome = mapNumbers(source, QueryOptions.builder().timeoutMs(120).build()).await().atMost(AWAIT);

        assertFalse(outcome.isDeferred());
        assertTrue(outcome.getResults().size() < 100);
    }

    @Test
    void testLimitIsPassedThroughAndExact() {
        InMemoryDocumentSourceTestDouble source = new InMemoryDocumentSourceTestDouble("numbers").addNumbered(10);

        QueryOutcome outcome = mapNumbers(source, QueryOptions.builder().limit(4L).build()).await().atMost(AWAIT);

        assertEquals(List.of(10, 9, 8, 7), outcome.getResults(), "Default order is descending by identity");
    }

    @Test
    void testValidationFailsSynchronously() {
        InMemoryDocumentSourceTestDouble source = people();
        QueryOptions options = QueryOptions.defaults();
        QueryDescriptor descriptor = QueryDescriptor.of(source.name(), Map.of(), OperationKind.RESOLVE, options);

        QueryValidationException noSource = assertThrows(QueryValidationException.class,
                () -> coordinator.runAndResolve(null, descriptor, surName(), options));
        assertEquals("source", noSource.getArgument());

        QueryValidationException noFilter = assertThrows(QueryValidationException.class,
                () -> coordinator.runAndResolve(source, QueryDescriptor.of(source.name(), null, OperationKind.RESOLVE, options), surName(), options));
        assertEquals("filter", noFilter.getArgument());

        QueryValidationException mismatch = assertThrows(QueryValidationException.class,
                () -> coordinator.runAndResolve(source, descriptor, DocumentOperation.map(doc -> doc), options));
        assertEquals("operation", mismatch.getArgument());

        QueryOptions badOptions = QueryOptions.builder().readOptions(Map.of("sortBy", "x")).build();
        QueryValidationException readOptions = assertThrows(QueryValidationException.class,
                () -> coordinator.runAndResolve(source, QueryDescriptor.of(source.name(), Map.of(), OperationKind.RESOLVE, badOptions), surName(), badOptions));
        assertEquals("readOptions", readOptions.getArgument());

        QueryOptions zeroBatch = QueryOptions.builder().batchSize(0).build();
        assertThrows(QueryValidationException.class,
                () -> coordinator.runAndResolve(source, QueryDescriptor.of(source.name(), Map.of(), OperationKind.RESOLVE, zeroBatch), surName(), zeroBatch));

        assertEquals(0, source.getOpenCount());
        assertTrue(coordinator.listRunningQueries().isEmpty());
    }

    @Test
    void testMaxPollCountRoundsUp() {
        assertEquals(180, CompletionPoller.maxPollCount(180_000, 1_000));
        assertEquals(2, CompletionPoller.maxPollCount(1_500, 1_000));
        assertEquals(1, CompletionPoller.maxPollCount(1, 1_000));
    }
}
