package com.e2eq.streamquery.coordinator;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Process wide knobs of a {@link QueryCoordinator}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class CoordinatorSettings {

    /** How long a cache entry lives after its last write or hit. */
    @Builder.Default
    private final Duration cacheTtl = Duration.ofMinutes(5);

    /** Admission limit for executions running in this process; zero or less disables it. */
    @Builder.Default
    private final int maxParallelProcesses = 5;

    /** Cadence of the cache store polls made while waiting on another process. */
    @Builder.Default
    private final Duration pollInterval = Duration.ofSeconds(1);

    /** Cadence at which abort requests are mirrored into running executions. */
    @Builder.Default
    private final Duration abortSyncInterval = Duration.ofMillis(5);

    /** Lifetime of the marker left behind by a failed execution; zero deletes the entry instead. */
    @Builder.Default
    private final Duration failureMarkerTtl = Duration.ZERO;

    public static CoordinatorSettings defaults() {
        return CoordinatorSettings.builder().build();
    }
}
