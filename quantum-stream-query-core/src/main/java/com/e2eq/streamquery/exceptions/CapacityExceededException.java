package com.e2eq.streamquery.exceptions;

/**
 * Admission control rejected a new execution. Nothing is queued; the caller has to retry later.
 */
public class CapacityExceededException extends StreamQueryException {
    private static final long serialVersionUID = 1L;

    private final int maxParallelProcesses;

    public CapacityExceededException(long fingerprint, int maxParallelProcesses) {
        super(fingerprint, String.format(
                "Max parallel process count (%d) reached, please wait for other queries to finish %d",
                maxParallelProcesses, fingerprint));
        this.maxParallelProcesses = maxParallelProcesses;
    }

    public int getMaxParallelProcesses() {
        return maxParallelProcesses;
    }
}
