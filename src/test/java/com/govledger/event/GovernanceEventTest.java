package com.govledger.event;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GovernanceEventTest {

    private static final Instant TIMESTAMP = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void shouldSplitContextIntoDeclaredAndExtraFields() {
        EventContext context = EventContext.of(
                Map.of("pac_id", "PAC-1", "amount", 12.5, "note", "manual review"),
                ContextSchema.DEFAULT);

        assertEquals(Map.of("pac_id", "PAC-1", "amount", 12.5), context.fields());
        assertEquals(Map.of("note", "manual review"), context.extra());
    }

    @Test
    void shouldRejectDeclaredContextFieldOfWrongType() {
        InvalidRecordException error = assertThrows(InvalidRecordException.class,
                () -> EventContext.of(Map.of("amount", "12"), ContextSchema.DEFAULT));

        assertEquals("context.amount", error.field());
    }

    @Test
    void shouldCopyContextIntoSortedMapsAndRejectMalformedBuckets() {
        Map<Object, Object> nested = new LinkedHashMap<>();
        nested.put("zone", "eu");
        nested.put("account", "A-1");
        EventContext context = EventContext.fromRecord(Map.of("extra", Map.of("route", nested)));

        assertEquals(List.of("account", "zone"), List.copyOf(((Map<?, ?>) context.extra().get("route")).keySet()));
        assertThrows(UnsupportedOperationException.class, () -> context.extra().put("late", 1));

        InvalidRecordException notAnObject = assertThrows(InvalidRecordException.class,
                () -> EventContext.fromRecord(Map.of("fields", List.of("pac_id"))));
        assertEquals("context.fields", notAnObject.field());

        Map<Object, Object> numericKey = new LinkedHashMap<>();
        numericKey.put(7, "seven");
        assertThrows(InvalidRecordException.class, () -> EventContext.fromRecord(Map.of("extra", numericKey)));
    }

    @Test
    void shouldRoundTripThroughCanonicalForm() throws Exception {
        GovernanceEvent event = new GovernanceEvent("evt-1", "DECISION", TIMESTAMP, "agent-7", "EXECUTE",
                "payments/transfer", "DENY", "RISK_TIER_EXCEEDED",
                EventContext.of(Map.of("pac_id", "PAC-1", "dry_run", false, "tags", List.of("a", "b")),
                        ContextSchema.DEFAULT));

        GovernanceEvent parsed = GovernanceEvent.fromRecord(CanonicalJson.parse(event.canonicalBytes()));

        assertEquals(event, parsed);
        assertArrayEquals(event.canonicalBytes(), parsed.canonicalBytes());
    }

    @Test
    void shouldEncodeAllFieldsWithSortedKeys() {
        GovernanceEvent event = new GovernanceEvent("evt-2", "DENIAL", TIMESTAMP, null, null, null, null, null, null);

        String line = new String(event.canonicalBytes(), StandardCharsets.UTF_8);

        assertEquals("{\"agent_id\":null,\"context\":{\"extra\":{},\"fields\":{}},\"decision\":null,"
                + "\"event_id\":\"evt-2\",\"event_type\":\"DENIAL\",\"reason_code\":null,\"target\":null,"
                + "\"timestamp\":\"2026-03-01T12:00:00Z\",\"verb\":null}", line);
        assertTrue(line.indexOf('\n') < 0);
    }

    @Test
    void shouldRejectMissingRequiredFields() {
        GovernanceEvent noId = new GovernanceEvent(" ", "DECISION", TIMESTAMP, null, null, null, null, null, null);
        GovernanceEvent noTimestamp = new GovernanceEvent("evt-3", "DECISION", null, null, null, null, null, null, null);

        assertEquals(GovernanceEvent.EVENT_ID,
                assertThrows(InvalidRecordException.class, noId::canonicalBytes).field());
        assertEquals(GovernanceEvent.TIMESTAMP,
                assertThrows(InvalidRecordException.class, noTimestamp::canonicalBytes).field());
    }

    @Test
    void shouldRejectUnparseableTimestampOnRead() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(GovernanceEvent.EVENT_ID, "evt-4");
        record.put(GovernanceEvent.EVENT_TYPE, "DECISION");
        record.put(GovernanceEvent.TIMESTAMP, "yesterday");

        assertThrows(InvalidRecordException.class, () -> GovernanceEvent.fromRecord(record));
    }
}
