package com.e2eq.streamquery.model;

import com.e2eq.streamquery.exceptions.QueryValidationException;

/**
 * The four per-document operations a streaming execution can apply.
 */
public enum OperationKind {
    /** Operation returns (keep, value); kept values are collected. */
    RESOLVE("resolve"),
    /** Operation returns a boolean; matching documents are collected as-is. */
    FILTER("filter"),
    /** Operation folds every document into a single accumulator. */
    REDUCE("reduce"),
    /** Operation transforms every document; every value is collected. */
    MAP("map");

    private final String label;

    OperationKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static OperationKind fromLabel(String label) {
        if (label != null) {
            for (OperationKind kind : values()) {
                if (kind.label.equalsIgnoreCase(label.trim())) {
                    return kind;
                }
            }
        }
        throw new QueryValidationException("operationKind",
                "expected one of resolve, filter, reduce, map but got " + label);
    }
}
