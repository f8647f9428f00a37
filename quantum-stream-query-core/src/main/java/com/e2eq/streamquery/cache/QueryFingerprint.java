package com.e2eq.streamquery.cache;

import com.e2eq.streamquery.model.QueryDescriptor;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Derives the cache key of a query from its shape. Only field names take part: the names used in
 * the filter and read options, plus synthetic names standing for order, limit, operation kind and
 * collection. Filter values are ignored, so filters testing different values on the same fields
 * share one key.
 */
public final class QueryFingerprint {

    static final String ORDER_MARKER = "order";
    static final String LIMIT_MARKER = "limit";
    static final String OPERATION_KIND_MARKER = "operationType";
    static final String COLLECTION_MARKER = "collection";
    static final String OPERATION_NAME_MARKER = "operation:";

    private static final HashFunction HASH = Hashing.murmur3_32_fixed(0);

    private QueryFingerprint() {}

    public static long computeKey(QueryDescriptor descriptor) {
        String joined = String.join("", shapeOf(descriptor));
        return Integer.toUnsignedLong(HASH.hashString(joined, StandardCharsets.UTF_8).asInt());
    }

    /**
     * The sorted set of names the key is computed from.
     */
    public static SortedSet<String> shapeOf(QueryDescriptor descriptor) {
        SortedSet<String> names = new TreeSet<>();
        addKeys(names, descriptor.getFilter());
        addKeys(names, descriptor.getReadOptions());
        names.add(ORDER_MARKER + (descriptor.getOrder() == null ? "" : descriptor.getOrder().direction()));
        names.add(LIMIT_MARKER + (descriptor.getLimit() == null ? "" : descriptor.getLimit()));
        names.add(OPERATION_KIND_MARKER + (descriptor.getOperationKind() == null ? "" : descriptor.getOperationKind().label()));
        names.add(COLLECTION_MARKER + (descriptor.getCollection() == null ? "" : descriptor.getCollection()));
        if (descriptor.getOperationName() != null && !descriptor.getOperationName().isBlank()) {
            names.add(OPERATION_NAME_MARKER + descriptor.getOperationName());
        }
        return names;
    }

    private static void addKeys(SortedSet<String> names, Map<String, Object> map) {
        if (map != null) {
            names.addAll(map.keySet());
        }
    }
}
