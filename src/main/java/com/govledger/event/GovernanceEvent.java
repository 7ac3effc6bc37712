package com.govledger.event;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

public record GovernanceEvent(
        String eventId,
        String eventType,
        Instant timestamp,
        String agentId,
        String verb,
        String target,
        String decision,
        String reasonCode,
        EventContext context) {

    public static final String EVENT_ID = "event_id";
    public static final String EVENT_TYPE = "event_type";
    public static final String TIMESTAMP = "timestamp";

    public GovernanceEvent {
        context = context == null ? EventContext.EMPTY : context;
    }

    public Map<String, Object> toRecord() {
        requireText(EVENT_ID, eventId);
        requireText(EVENT_TYPE, eventType);
        if (timestamp == null) {
            throw new InvalidRecordException(TIMESTAMP, "required field is missing");
        }
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(EVENT_ID, eventId);
        record.put(EVENT_TYPE, eventType);
        record.put(TIMESTAMP, timestamp.toString());
        record.put("agent_id", agentId);
        record.put("verb", verb);
        record.put("target", target);
        record.put("decision", decision);
        record.put("reason_code", reasonCode);
        record.put("context", context.toRecord());
        return record;
    }

    public byte[] canonicalBytes() {
        return CanonicalJson.canonicalize(toRecord());
    }

    public static GovernanceEvent fromRecord(Map<String, ?> record) {
        return new GovernanceEvent(
                text(record, EVENT_ID),
                text(record, EVENT_TYPE),
                parseTimestamp(record.get(TIMESTAMP)),
                text(record, "agent_id"),
                text(record, "verb"),
                text(record, "target"),
                text(record, "decision"),
                text(record, "reason_code"),
                EventContext.fromRecord(record.get("context")));
    }

    public static Instant parseTimestamp(Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new InvalidRecordException(TIMESTAMP, "required field is missing");
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException(TIMESTAMP, "not an ISO-8601 UTC instant: " + text);
        }
    }

    private static String text(Map<String, ?> record, String key) {
        Object value = record.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new InvalidRecordException(key, "expected a string");
        }
        return text;
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRecordException(field, "required field is missing");
        }
    }
}
