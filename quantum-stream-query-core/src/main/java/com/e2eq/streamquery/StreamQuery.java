package com.e2eq.streamquery;

import com.e2eq.streamquery.coordinator.QueryCoordinator;
import com.e2eq.streamquery.model.OperationKind;
import com.e2eq.streamquery.model.QueryDescriptor;
import com.e2eq.streamquery.model.QueryOptions;
import com.e2eq.streamquery.model.QueryOutcome;
import com.e2eq.streamquery.model.RunningQuerySnapshot;
import com.e2eq.streamquery.operation.DocumentOperation;
import com.e2eq.streamquery.operation.Resolution;
import com.e2eq.streamquery.source.DocumentSource;
import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Named operations over a {@link QueryCoordinator}.
 *
 * <pre>{@code
 * streamQuery.resolve(people, Map.of("firstName", Map.of("$regex", "Chris")),
 *         doc -> Resolution.keep(doc.get("surName")), QueryOptions.defaults())
 *     .await().atMost(Duration.ofSeconds(5));
 * }</pre>
 */
public class StreamQuery {

    private final QueryCoordinator coordinator;

    public StreamQuery(QueryCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Collects the value of every document for which {@code fn} answers keep.
     */
    public Uni<QueryOutcome> resolve(DocumentSource source, Map<String, Object> filter,
                                     Function<Map<String, Object>, Resolution> fn, QueryOptions options) {
        return run(source, filter, OperationKind.RESOLVE, fn == null ? null : DocumentOperation.resolve(fn), options);
    }

    /**
     * Collects the documents matching {@code predicate}.
     */
    public Uni<QueryOutcome> filter(DocumentSource source, Map<String, Object> filter,
                                    Predicate<Map<String, Object>> predicate, QueryOptions options) {
        return run(source, filter, OperationKind.FILTER, predicate == null ? null : DocumentOperation.filter(predicate), options);
    }

    /**
     * Folds every document into one value, starting from {@code options.initialValue}.
     */
    public Uni<QueryOutcome> reduce(DocumentSource source, Map<String, Object> filter,
                                    BiFunction<Object, Map<String, Object>, Object> fn, QueryOptions options) {
        return run(source, filter, OperationKind.REDUCE, fn == null ? null : DocumentOperation.reduce(fn), options);
    }

    /**
     * Collects the transformation of every document.
     */
    public Uni<QueryOutcome> map(DocumentSource source, Map<String, Object> filter,
                                 Function<Map<String, Object>, Object> fn, QueryOptions options) {
        return run(source, filter, OperationKind.MAP, fn == null ? null : DocumentOperation.map(fn), options);
    }

    public long fingerprintOf(DocumentSource source, Map<String, Object> filter, OperationKind kind, QueryOptions options) {
        QueryOptions effective = options == null ? QueryOptions.defaults() : options;
        return coordinator.fingerprintOf(QueryDescriptor.of(source == null ? null : source.name(), filter, kind, effective));
    }

    public List<RunningQuerySnapshot> getRunningQueries() {
        return coordinator.listRunningQueries();
    }

    public boolean abortRunningQuery(long fingerprint) {
        return coordinator.requestAbort(fingerprint);
    }

    public Optional<List<Object>> getCachedResult(long fingerprint) {
        return coordinator.getCachedResult(fingerprint);
    }

    public void deleteCachedResult(long fingerprint) {
        coordinator.invalidate(fingerprint);
    }

    private Uni<QueryOutcome> run(DocumentSource source, Map<String, Object> filter, OperationKind kind,
                                  DocumentOperation operation, QueryOptions options) {
        QueryOptions effective = options == null ? QueryOptions.defaults() : options;
        QueryDescriptor descriptor = QueryDescriptor.of(source == null ? null : source.name(), filter, kind, effective);
        return coordinator.runAndResolve(source, descriptor, operation, effective);
    }
}
