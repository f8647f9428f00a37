package com.e2eq.streamquery.source;

import java.util.Iterator;
import java.util.Map;

/**
 * Lazily streamed, paged cursor over matching documents. {@link #hasNext()} and {@link #next()}
 * may block while a page is fetched and throw when the transport fails.
 */
public interface DocumentCursor extends Iterator<Map<String, Object>>, AutoCloseable {

    /**
     * Terminates the cursor on demand. Must be safe to call from a thread other than the one
     * consuming the cursor; a consumer blocked in {@link #hasNext()} may then see an exception.
     */
    void cancel();

    @Override
    void close();
}
