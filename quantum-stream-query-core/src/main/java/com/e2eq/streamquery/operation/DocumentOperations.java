package com.e2eq.streamquery.operation;

import com.e2eq.streamquery.model.OperationKind;

import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

final class DocumentOperations {

    private DocumentOperations() {}

    static final class ResolveOperation implements DocumentOperation {
        private final Function<Map<String, Object>, Resolution> fn;

        ResolveOperation(Function<Map<String, Object>, Resolution> fn) {
            this.fn = fn;
        }

        @Override
        public OperationKind kind() {
            return OperationKind.RESOLVE;
        }

        @Override
        public void apply(ResultAccumulator accumulator, Map<String, Object> document) {
            Resolution resolution = fn.apply(document);
            if (resolution != null && resolution.keep()) {
                accumulator.append(resolution.value());
            }
        }
    }

    static final class FilterOperation implements DocumentOperation {
        private final Predicate<Map<String, Object>> predicate;

        FilterOperation(Predicate<Map<String, Object>> predicate) {
            this.predicate = predicate;
        }

        @Override
        public OperationKind kind() {
            return OperationKind.FILTER;
        }

        @Override
        public void apply(ResultAccumulator accumulator, Map<String, Object> document) {
            if (predicate.test(document)) {
                accumulator.append(document);
            }
        }
    }

    static final class ReduceOperation implements DocumentOperation {
        private final BiFunction<Object, Map<String, Object>, Object> fn;

        ReduceOperation(BiFunction<Object, Map<String, Object>, Object> fn) {
            this.fn = fn;
        }

        @Override
        public OperationKind kind() {
            return OperationKind.REDUCE;
        }

        @Override
        public void apply(ResultAccumulator accumulator, Map<String, Object> document) {
            // a throwing fold leaves the previous accumulator in place
            accumulator.replace(fn.apply(accumulator.current(), document));
        }
    }

    static final class MapOperation implements DocumentOperation {
        private final Function<Map<String, Object>, Object> fn;

        MapOperation(Function<Map<String, Object>, Object> fn) {
            this.fn = fn;
        }

        @Override
        public OperationKind kind() {
            return OperationKind.MAP;
        }

        @Override
        public void apply(ResultAccumulator accumulator, Map<String, Object> document) {
            accumulator.append(fn.apply(document));
        }
    }
}
