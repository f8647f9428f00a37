package com.e2eq.streamquery.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything that identifies a query for caching and coordination: target collection, filter,
 * read options, order, limit and operation kind. Built per call and never persisted.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class QueryDescriptor {

    private final String collection;
    private final Map<String, Object> filter;
    private final Map<String, Object> readOptions;
    private final SortOrder order;
    private final Long limit;
    private final OperationKind operationKind;
    private final String operationName;

    public QueryDescriptor(String collection,
                           Map<String, Object> filter,
                           Map<String, Object> readOptions,
                           SortOrder order,
                           Long limit,
                           OperationKind operationKind,
                           String operationName) {
        this.collection = collection;
        this.filter = copy(filter);
        this.readOptions = copy(readOptions);
        this.order = order;
        this.limit = limit;
        this.operationKind = operationKind;
        this.operationName = operationName;
    }

    /**
     * Builds the descriptor for a call against {@code collection} using the order, limit, read
     * options and operation name of {@code options}.
     */
    public static QueryDescriptor of(String collection,
                                     Map<String, Object> filter,
                                     OperationKind operationKind,
                                     QueryOptions options) {
        return new QueryDescriptor(collection, filter, options.getReadOptions(), options.getOrder(),
                options.getLimit(), operationKind, options.getOperationName());
    }

    // null stays null so validation can report it
    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null) {
            return null;
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
