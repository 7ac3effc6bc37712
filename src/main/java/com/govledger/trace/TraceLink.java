package com.govledger.trace;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.govledger.event.CanonicalJson;
import com.govledger.event.GovernanceEvent;
import com.govledger.event.Hashing;
import com.govledger.event.InvalidRecordException;

public record TraceLink(
        String linkId,
        long sequence,
        TraceDomain fromDomain,
        String fromRef,
        TraceDomain toDomain,
        String toRef,
        TraceLinkType linkType,
        String decisionRef,
        Instant registeredAt,
        String prevHash,
        String linkHash) {

    public String computeHash() {
        return Hashing.sha256Hex(CanonicalJson.canonicalize(hashedFields()), prevHash);
    }

    public TraceLink sealed() {
        return new TraceLink(linkId, sequence, fromDomain, fromRef, toDomain, toRef, linkType, decisionRef,
                registeredAt, prevHash, computeHash());
    }

    public TraceNode from() {
        return new TraceNode(fromDomain, fromRef);
    }

    public TraceNode to() {
        return new TraceNode(toDomain, toRef);
    }

    Map<String, Object> hashedFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("link_id", linkId);
        fields.put("sequence", sequence);
        fields.put("from_domain", fromDomain.name());
        fields.put("from_ref", fromRef);
        fields.put("to_domain", toDomain.name());
        fields.put("to_ref", toRef);
        fields.put("link_type", linkType.name());
        fields.put("decision_ref", decisionRef);
        fields.put("registered_at", registeredAt.toString());
        return fields;
    }

    public Map<String, Object> toRecord() {
        Map<String, Object> record = hashedFields();
        record.put("prev_hash", prevHash);
        record.put("link_hash", linkHash);
        return record;
    }

    public static TraceLink fromRecord(Map<String, ?> record) {
        return new TraceLink(
                text(record, "link_id"),
                number(record, "sequence"),
                domain(record, "from_domain"),
                text(record, "from_ref"),
                domain(record, "to_domain"),
                text(record, "to_ref"),
                linkType(record),
                optionalText(record, "decision_ref"),
                instant(record),
                text(record, "prev_hash"),
                text(record, "link_hash"));
    }

    private static String text(Map<String, ?> record, String key) {
        String value = optionalText(record, key);
        if (value == null) {
            throw new InvalidRecordException(key, "required field is missing");
        }
        return value;
    }

    private static String optionalText(Map<String, ?> record, String key) {
        Object value = record.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new InvalidRecordException(key, "expected a string");
        }
        return text;
    }

    private static long number(Map<String, ?> record, String key) {
        Object value = record.get(key);
        if (!(value instanceof Integer || value instanceof Long)) {
            throw new InvalidRecordException(key, "expected an integer");
        }
        return ((Number) value).longValue();
    }

    private static TraceDomain domain(Map<String, ?> record, String key) {
        try {
            return TraceDomain.valueOf(text(record, key));
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException(key, "unknown domain " + record.get(key));
        }
    }

    private static TraceLinkType linkType(Map<String, ?> record) {
        try {
            return TraceLinkType.valueOf(text(record, "link_type"));
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException("link_type", "unknown link type " + record.get("link_type"));
        }
    }

    private static Instant instant(Map<String, ?> record) {
        try {
            return GovernanceEvent.parseTimestamp(record.get("registered_at"));
        } catch (InvalidRecordException e) {
            throw new InvalidRecordException("registered_at", e.getMessage());
        }
    }
}
