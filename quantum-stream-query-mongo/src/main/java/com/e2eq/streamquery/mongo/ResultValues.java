package com.e2eq.streamquery.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Turns the values collected by an execution into something the driver can encode. Values the
 * driver understands are kept, maps become {@link Document}s, and any other object is converted
 * into its JSON tree with Jackson first.
 */
class ResultValues {

    private final ObjectMapper mapper;

    ResultValues(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    List<Object> normalize(List<Object> values) {
        if (values == null) {
            return List.of();
        }
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            normalized.add(normalizeValue(value));
        }
        return normalized;
    }

    Object normalizeValue(Object value) {
        if (value == null || isNative(value)) {
            return value;
        }
        if (value instanceof Instant) {
            return Date.from((Instant) value);
        }
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            return big.bitLength() < 64 ? (Object) big.longValue() : big.toString();
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        if (value instanceof Map) {
            Document document = new Document();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                document.append(String.valueOf(entry.getKey()), normalizeValue(entry.getValue()));
            }
            return document;
        }
        if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                list.add(normalizeValue(element));
            }
            return list;
        }
        if (value.getClass().isArray() && !(value instanceof byte[])) {
            return normalizeValue(mapper.convertValue(value, List.class));
        }
        // beans and everything else go through their JSON representation
        Object tree = mapper.convertValue(value, Object.class);
        if (tree != null && tree.getClass() == value.getClass()) {
            throw new IllegalArgumentException("Cannot store result value of type " + value.getClass().getName());
        }
        return normalizeValue(tree);
    }

    private static boolean isNative(Object value) {
        return value instanceof String
                || value instanceof Number && !(value instanceof BigInteger)
                || value instanceof Boolean
                || value instanceof Date
                || value instanceof ObjectId
                || value instanceof Decimal128
                || value instanceof Binary
                || value instanceof byte[]
                || value instanceof UUID
                || value instanceof Pattern;
    }
}
