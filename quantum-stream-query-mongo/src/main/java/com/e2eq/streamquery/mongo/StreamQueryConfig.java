package com.e2eq.streamquery.mongo;

import com.e2eq.streamquery.coordinator.CoordinatorSettings;
import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

@StaticInitSafe
@ConfigMapping(prefix = "stream-query")
public interface StreamQueryConfig {

    /** Collection holding the cache entries, in the {@code quarkus.mongodb.database} database. */
    @WithDefault("stream_query_cache")
    String cacheCollection();

    @WithDefault("300000")
    long cacheTimeMs();

    @WithDefault("5")
    int maxParallelProcesses();

    @WithDefault("1000")
    long pollIntervalMs();

    @WithDefault("5")
    long abortSyncIntervalMs();

    /** Zero deletes the entry of a failed execution, anything above leaves a failure marker behind. */
    @WithDefault("0")
    long failureMarkerTtlMs();

    default CoordinatorSettings toSettings() {
        return CoordinatorSettings.builder()
                .cacheTtl(Duration.ofMillis(cacheTimeMs()))
                .maxParallelProcesses(maxParallelProcesses())
                .pollInterval(Duration.ofMillis(pollIntervalMs()))
                .abortSyncInterval(Duration.ofMillis(abortSyncIntervalMs()))
                .failureMarkerTtl(Duration.ofMillis(failureMarkerTtlMs()))
                .build();
    }
}
