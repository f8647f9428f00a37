package com.e2eq.streamquery.source;

import com.e2eq.streamquery.exceptions.QueryValidationException;

import java.util.Map;

/**
 * A named document collection that can be streamed through a cursor. Implementations can be
 * backed by MongoDB, in-memory lists, or others.
 */
public interface DocumentSource {

    /**
     * Name of the collection, folded into query fingerprints.
     */
    String name();

    DocumentCursor open(CursorRequest request);

    /**
     * Rejects read options this source does not understand. Called before any I/O happens.
     *
     * @throws QueryValidationException naming {@code readOptions}
     */
    default void validateReadOptions(Map<String, Object> readOptions) {
    }
}
