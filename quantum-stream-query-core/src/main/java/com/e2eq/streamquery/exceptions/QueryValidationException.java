package com.e2eq.streamquery.exceptions;

/**
 * Thrown synchronously, before any I/O, when a query argument is malformed.
 */
public class QueryValidationException extends StreamQueryException {
    private static final long serialVersionUID = 1L;

    private final String argument;

    public QueryValidationException(String argument, String message) {
        super(String.format("Invalid argument '%s': %s", argument, message));
        this.argument = argument;
    }

    /**
     * Name of the offending argument.
     */
    public String getArgument() {
        return argument;
    }
}
