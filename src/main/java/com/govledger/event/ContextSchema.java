package com.govledger.event;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record ContextSchema(Map<String, FieldType> declaredFields) {

    public static final ContextSchema EMPTY = new ContextSchema(Map.of());

    public static final ContextSchema DEFAULT = new ContextSchema(Map.of(
            "pac_id", FieldType.STRING,
            "pdo_id", FieldType.STRING,
            "policy_version", FieldType.STRING,
            "risk_tier", FieldType.STRING,
            "amount", FieldType.NUMBER,
            "dry_run", FieldType.BOOLEAN));

    public ContextSchema {
        declaredFields = declaredFields == null ? Map.of() : Map.copyOf(new TreeMap<>(declaredFields));
    }

    public boolean declares(String key) {
        return declaredFields.containsKey(key);
    }

    void check(String key, Object value) {
        FieldType type = declaredFields.get(key);
        if (type == null || value == null) {
            return;
        }
        if (!type.accepts(value)) {
            throw new InvalidRecordException("context." + key,
                    "expected " + type + " but got " + value.getClass().getSimpleName());
        }
    }

    public enum FieldType {
        STRING,
        NUMBER,
        BOOLEAN,
        LIST,
        MAP;

        boolean accepts(Object value) {
            return switch (this) {
                case STRING -> value instanceof String;
                case NUMBER -> value instanceof Number;
                case BOOLEAN -> value instanceof Boolean;
                case LIST -> value instanceof List<?>;
                case MAP -> value instanceof Map<?, ?>;
            };
        }
    }
}
