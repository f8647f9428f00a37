package com.e2eq.streamquery.operation;

import com.e2eq.streamquery.model.OperationKind;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A caller supplied per-document function, tagged with the operation kind it implements.
 * Instances are created through the static factories, one per kind.
 */
public interface DocumentOperation {

    OperationKind kind();

    /**
     * Applies the function to one document and folds the outcome into {@code accumulator}.
     * Any exception thrown by the caller's function propagates to the engine, which counts it.
     */
    void apply(ResultAccumulator accumulator, Map<String, Object> document);

    static DocumentOperation resolve(Function<Map<String, Object>, Resolution> fn) {
        Objects.requireNonNull(fn, "fn");
        return new DocumentOperations.ResolveOperation(fn);
    }

    static DocumentOperation filter(Predicate<Map<String, Object>> predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new DocumentOperations.FilterOperation(predicate);
    }

    static DocumentOperation reduce(BiFunction<Object, Map<String, Object>, Object> fn) {
        Objects.requireNonNull(fn, "fn");
        return new DocumentOperations.ReduceOperation(fn);
    }

    static DocumentOperation map(Function<Map<String, Object>, Object> fn) {
        Objects.requireNonNull(fn, "fn");
        return new DocumentOperations.MapOperation(fn);
    }
}
