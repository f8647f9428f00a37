package com.e2eq.streamquery.exceptions;

/**
 * A streaming execution failed outright, e.g. the cursor or transport broke. Accumulated results
 * are discarded.
 */
public class QueryExecutionException extends StreamQueryException {
    private static final long serialVersionUID = 1L;

    public QueryExecutionException(long fingerprint, String message) {
        super(fingerprint, message);
    }

    public QueryExecutionException(long fingerprint, String message, Throwable cause) {
        super(fingerprint, message, cause);
    }
}
