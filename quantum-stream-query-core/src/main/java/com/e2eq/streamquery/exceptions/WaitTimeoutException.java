package com.e2eq.streamquery.exceptions;

/**
 * A caller waiting for another execution of the same fingerprint gave up. The execution being
 * waited on is not affected.
 */
public class WaitTimeoutException extends StreamQueryException {
    private static final long serialVersionUID = 1L;

    private final int attempts;

    public WaitTimeoutException(long fingerprint, int attempts) {
        super(fingerprint, String.format("Max poll count reached (%d) while waiting for %d", attempts, fingerprint));
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
