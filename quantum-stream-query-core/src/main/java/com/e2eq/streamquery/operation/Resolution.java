package com.e2eq.streamquery.operation;

/**
 * Answer of a resolve operation for one document: whether to keep it and the value to collect.
 */
public record Resolution(boolean keep, Object value) {

    public static Resolution keep(Object value) {
        return new Resolution(true, value);
    }

    public static Resolution discard() {
        return new Resolution(false, null);
    }
}
