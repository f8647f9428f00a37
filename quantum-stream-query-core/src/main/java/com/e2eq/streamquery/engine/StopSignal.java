package com.e2eq.streamquery.engine;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation token of one execution. The first reason to arrive wins.
 */
final class StopSignal {

    enum Reason { NONE, ABORTED, TIMED_OUT }

    private final AtomicReference<Reason> reason = new AtomicReference<>(Reason.NONE);

    /**
     * @return true if this call stopped the execution, false if it was already stopped
     */
    boolean stop(Reason why) {
        return reason.compareAndSet(Reason.NONE, why);
    }

    boolean isStopped() {
        return reason.get() != Reason.NONE;
    }

    Reason reason() {
        return reason.get();
    }
}
