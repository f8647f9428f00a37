package com.e2eq.streamquery.mongo;

import com.e2eq.streamquery.model.CacheEntry;
import org.bson.Document;

import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Field names of a cache entry document and the mapping back to {@link CacheEntry}.
 */
final class CacheEntryDocuments {

    static final String FINGERPRINT = "fingerprint";
    static final String IN_PROGRESS = "inProgress";
    static final String FAILED = "failed";
    static final String RESULT = "result";
    static final String EXPIRES_AT = "expiresAt";

    private CacheEntryDocuments() {}

    static CacheEntry toEntry(Document document) {
        long fingerprint = ((Number) document.get(FINGERPRINT)).longValue();
        Date expires = document.getDate(EXPIRES_AT);
        Instant expiresAt = expires == null ? null : expires.toInstant();

        if (document.getBoolean(FAILED, false)) {
            return CacheEntry.failed(fingerprint, expiresAt);
        }
        if (document.getBoolean(IN_PROGRESS, false)) {
            return CacheEntry.inProgress(fingerprint, expiresAt);
        }
        @SuppressWarnings("unchecked")
        List<Object> result = (List<Object>) document.get(RESULT, List.class);
        return CacheEntry.completed(fingerprint, result, expiresAt);
    }

    static boolean isExpired(Document document, Instant now) {
        Date expires = document.getDate(EXPIRES_AT);
        return expires != null && expires.toInstant().isBefore(now);
    }
}
