package com.e2eq.streamquery.mongo;

import com.e2eq.streamquery.exceptions.QueryValidationException;
import com.mongodb.client.FindIterable;
import org.bson.Document;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * The read options a MongoDB source understands and how each one shapes a find.
 */
final class MongoReadOptions {

    static final String PROJECTION = "projection";
    static final String SKIP = "skip";
    static final String HINT = "hint";
    static final String COMMENT = "comment";
    static final String MAX_TIME_MS = "maxTimeMS";
    static final String NO_CURSOR_TIMEOUT = "noCursorTimeout";
    static final String ALLOW_DISK_USE = "allowDiskUse";

    private MongoReadOptions() {}

    static void validate(Map<String, Object> readOptions) {
        for (Map.Entry<String, Object> option : readOptions.entrySet()) {
            Object value = option.getValue();
            switch (option.getKey()) {
                case PROJECTION:
                    require(value instanceof Map, "projection must be a mapping");
                    break;
                case SKIP:
                    require(value instanceof Number && ((Number) value).longValue() >= 0, "skip must be a non-negative number");
                    break;
                case HINT:
                    require(value instanceof Map || value instanceof String, "hint must be an index name or key mapping");
                    break;
                case COMMENT:
                    require(value instanceof String, "comment must be a string");
                    break;
                case MAX_TIME_MS:
                    require(value instanceof Number && ((Number) value).longValue() > 0, "maxTimeMS must be a positive number");
                    break;
                case NO_CURSOR_TIMEOUT:
                case ALLOW_DISK_USE:
                    require(value instanceof Boolean, option.getKey() + " must be a boolean");
                    break;
                default:
                    throw new QueryValidationException("readOptions", "unsupported read option " + option.getKey());
            }
        }
    }

    @SuppressWarnings("unchecked")
    static FindIterable<Document> apply(FindIterable<Document> find, Map<String, Object> readOptions) {
        FindIterable<Document> shaped = find;
        for (Map.Entry<String, Object> option : readOptions.entrySet()) {
            Object value = option.getValue();
            switch (option.getKey()) {
                case PROJECTION:
                    shaped = shaped.projection(new Document((Map<String, Object>) value));
                    break;
                case SKIP:
                    shaped = shaped.skip(((Number) value).intValue());
                    break;
                case HINT:
                    shaped = value instanceof String
                            ? shaped.hintString((String) value)
                            : shaped.hint(new Document((Map<String, Object>) value));
                    break;
                case COMMENT:
                    shaped = shaped.comment((String) value);
                    break;
                case MAX_TIME_MS:
                    shaped = shaped.maxTime(((Number) value).longValue(), TimeUnit.MILLISECONDS);
                    break;
                case NO_CURSOR_TIMEOUT:
                    shaped = shaped.noCursorTimeout((Boolean) value);
                    break;
                case ALLOW_DISK_USE:
                    shaped = shaped.allowDiskUse((Boolean) value);
                    break;
                default:
                    throw new QueryValidationException("readOptions", "unsupported read option " + option.getKey());
            }
        }
        return shaped;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new QueryValidationException("readOptions", message);
        }
    }
}
