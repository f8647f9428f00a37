package com.e2eq.streamquery.source;

import com.e2eq.streamquery.model.SortOrder;

import java.util.Map;

/**
 * Parameters for opening a cursor: match criteria, read options, order by document identity and
 * page size.
 */
public record CursorRequest(Map<String, Object> filter,
                            Map<String, Object> readOptions,
                            SortOrder order,
                            int batchSize) {
}
