package com.govledger.event;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Deterministic JSON encoding shared by the ledger, the trace registry and the audit bundle.
 *
 * <p>Keys are sorted lexicographically at every nesting level, separators are compact and
 * values are restricted to a closed type set: string, finite number, boolean, null, and maps
 * (string keys) or lists built from those. Anything else is rejected with
 * {@link InvalidRecordException} before a single byte is produced.
 */
public final class CanonicalJson {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private CanonicalJson() {
    }

    public static byte[] canonicalize(Map<String, ?> record) {
        if (record == null) {
            throw new InvalidRecordException(null, "record must not be null");
        }
        Object normalized = normalize("", record);
        try {
            return MAPPER.writeValueAsBytes(normalized);
        } catch (JsonProcessingException e) {
            throw new InvalidRecordException(null, "unserializable record: " + e.getOriginalMessage());
        }
    }

    public static String canonicalString(Map<String, ?> record) {
        return new String(canonicalize(record), StandardCharsets.UTF_8);
    }

    public static Map<String, Object> parse(byte[] json) throws IOException {
        return requireObject(MAPPER.readValue(json, RECORD_TYPE));
    }

    public static Map<String, Object> parse(String json) throws IOException {
        return requireObject(MAPPER.readValue(json, RECORD_TYPE));
    }

    private static Map<String, Object> requireObject(Map<String, Object> parsed) throws IOException {
        if (parsed == null) {
            throw new JsonParseException(null, "expected a JSON object but found null");
        }
        return parsed;
    }

    static Object normalize(String path, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger || value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new InvalidRecordException(pathOrRoot(path), "non-finite number " + value);
            }
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            return normalizeMap(path, map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            int index = 0;
            for (Object item : collection) {
                copy.add(normalize(path + "[" + index++ + "]", item));
            }
            return Collections.unmodifiableList(copy);
        }
        throw new InvalidRecordException(pathOrRoot(path), "unsupported value type " + value.getClass().getName());
    }

    static SortedMap<String, Object> normalizeMap(String path, Map<?, ?> map) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new InvalidRecordException(pathOrRoot(path), "map key must be a string, got " + entry.getKey());
            }
            sorted.put(key, normalize(path.isEmpty() ? key : path + "." + key, entry.getValue()));
        }
        return Collections.unmodifiableSortedMap(sorted);
    }

    private static String pathOrRoot(String path) {
        return path.isEmpty() ? "<root>" : path;
    }
}
