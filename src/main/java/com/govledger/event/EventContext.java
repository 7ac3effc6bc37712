package com.govledger.event;

import java.util.LinkedHashMap;
import java.util.Map;

public record EventContext(Map<String, Object> fields, Map<String, Object> extra) {

    public static final EventContext EMPTY = new EventContext(Map.of(), Map.of());

    public EventContext {
        fields = CanonicalJson.normalizeMap("context.fields", fields == null ? Map.of() : fields);
        extra = CanonicalJson.normalizeMap("context.extra", extra == null ? Map.of() : extra);
    }

    public static EventContext of(Map<String, ?> raw, ContextSchema schema) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> declared = new LinkedHashMap<>();
        Map<String, Object> undeclared = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            if (schema.declares(entry.getKey())) {
                schema.check(entry.getKey(), entry.getValue());
                declared.put(entry.getKey(), entry.getValue());
            } else {
                undeclared.put(entry.getKey(), entry.getValue());
            }
        }
        return new EventContext(declared, undeclared);
    }

    Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("fields", fields);
        record.put("extra", extra);
        return record;
    }

    static EventContext fromRecord(Object value) {
        if (value == null) {
            return EMPTY;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidRecordException("context", "expected an object");
        }
        return new EventContext(bucket("context.fields", map.get("fields")), bucket("context.extra", map.get("extra")));
    }

    private static Map<String, Object> bucket(String path, Object value) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidRecordException(path, "expected an object");
        }
        return CanonicalJson.normalizeMap(path, map);
    }
}
