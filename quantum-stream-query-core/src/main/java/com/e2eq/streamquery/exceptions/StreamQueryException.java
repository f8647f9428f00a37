package com.e2eq.streamquery.exceptions;

/**
 * Base type for failures raised by the stream query engine. Carries the fingerprint of the
 * query involved when one has been computed.
 */
public class StreamQueryException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Long fingerprint;

    public StreamQueryException(String message) {
        super(message);
        this.fingerprint = null;
    }

    public StreamQueryException(String message, Throwable cause) {
        super(message, cause);
        this.fingerprint = null;
    }

    public StreamQueryException(long fingerprint, String message) {
        super(message);
        this.fingerprint = fingerprint;
    }

    public StreamQueryException(long fingerprint, String message, Throwable cause) {
        super(message, cause);
        this.fingerprint = fingerprint;
    }

    /**
     * The fingerprint of the query this failure belongs to, or {@code null} when the failure
     * happened before one was computed.
     */
    public Long getFingerprint() {
        return fingerprint;
    }
}
