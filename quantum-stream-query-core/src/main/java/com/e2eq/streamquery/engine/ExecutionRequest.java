package com.e2eq.streamquery.engine;

import com.e2eq.streamquery.model.SortOrder;
import com.e2eq.streamquery.operation.DocumentOperation;
import com.e2eq.streamquery.source.DocumentSource;

import java.time.Duration;
import java.util.Map;

/**
 * Everything the streaming engine needs to run one execution.
 */
public record ExecutionRequest(long fingerprint,
                               DocumentSource source,
                               Map<String, Object> filter,
                               Map<String, Object> readOptions,
                               DocumentOperation operation,
                               Object initialValue,
                               int batchSize,
                               SortOrder order,
                               Duration timeout,
                               Long limit) {
}
