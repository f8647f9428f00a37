package com.e2eq.streamquery.model;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of an execution running in this process.
 */
public record RunningQuerySnapshot(
        long fingerprint,
        OperationKind operationKind,
        Map<String, Object> filter,
        Instant startedAt,
        Instant timesOutAt,
        long processedDocuments,
        long collectedResults,
        long documentErrors,
        boolean inAbortion) {
}
