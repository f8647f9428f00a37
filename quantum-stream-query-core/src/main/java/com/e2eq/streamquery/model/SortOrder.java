package com.e2eq.streamquery.model;

import com.e2eq.streamquery.exceptions.QueryValidationException;

/**
 * Order in which documents are streamed, by document identity.
 */
public enum SortOrder {
    ASCENDING(1),
    DESCENDING(-1);

    private final int direction;

    SortOrder(int direction) {
        this.direction = direction;
    }

    public int direction() {
        return direction;
    }

    public static SortOrder fromDirection(int direction) {
        switch (direction) {
            case 1:
                return ASCENDING;
            case -1:
                return DESCENDING;
            default:
                throw new QueryValidationException("order", "expected 1 or -1 but got " + direction);
        }
    }
}
