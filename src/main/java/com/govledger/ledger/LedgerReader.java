package com.govledger.ledger;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.govledger.event.CanonicalJson;
import com.govledger.event.GovernanceEvent;
import com.govledger.event.InvalidRecordException;

public class LedgerReader {
    private final LedgerSource source;

    public LedgerReader(LedgerSource source) {
        this.source = source;
    }

    public List<GovernanceEvent> readAll() throws IOException {
        List<GovernanceEvent> events = new ArrayList<>();
        forEach(null, null, events::add);
        return events;
    }

    public void forEach(Instant start, Instant end, EventVisitor visitor) throws IOException {
        try (LedgerSnapshot snapshot = source.openSnapshot()) {
            snapshot.forEachLine((segment, lineNumber, line) -> {
                GovernanceEvent event = parse(segment, lineNumber, line);
                if (inWindow(event.timestamp(), start, end)) {
                    visitor.visit(event);
                }
            });
        }
    }

    public ExportSummary summary(Instant start, Instant end) throws IOException {
        Map<String, Integer> byType = new TreeMap<>();
        Instant[] range = new Instant[2];
        int[] total = new int[1];
        try (LedgerSnapshot snapshot = source.openSnapshot()) {
            snapshot.forEachLine((segment, lineNumber, line) -> {
                GovernanceEvent event = parse(segment, lineNumber, line);
                if (!inWindow(event.timestamp(), start, end)) {
                    return;
                }
                total[0]++;
                byType.merge(event.eventType(), 1, Integer::sum);
                if (range[0] == null || event.timestamp().isBefore(range[0])) {
                    range[0] = event.timestamp();
                }
                if (range[1] == null || event.timestamp().isAfter(range[1])) {
                    range[1] = event.timestamp();
                }
            });
            return new ExportSummary(total[0], snapshot.segments().size(), range[0], range[1], Map.copyOf(byType), start, end);
        }
    }

    public static boolean inWindow(Instant timestamp, Instant start, Instant end) {
        if (start != null && timestamp.isBefore(start)) {
            return false;
        }
        return end == null || timestamp.isBefore(end);
    }

    public static Instant timestampOf(String segment, long lineNumber, byte[] line) throws LedgerFormatException {
        try {
            return GovernanceEvent.parseTimestamp(CanonicalJson.parse(line).get(GovernanceEvent.TIMESTAMP));
        } catch (IOException | InvalidRecordException e) {
            throw new LedgerFormatException(segment, lineNumber, "unreadable ledger record", e);
        }
    }

    static GovernanceEvent parse(String segment, long lineNumber, byte[] line) throws LedgerFormatException {
        try {
            return GovernanceEvent.fromRecord(CanonicalJson.parse(line));
        } catch (IOException | InvalidRecordException e) {
            throw new LedgerFormatException(segment, lineNumber, "unreadable ledger record", e);
        }
    }

    @FunctionalInterface
    public interface EventVisitor {
        void visit(GovernanceEvent event) throws IOException;
    }

    public record ExportSummary(
            int totalEvents,
            int filesScanned,
            Instant earliest,
            Instant latest,
            Map<String, Integer> eventTypes,
            Instant filterStart,
            Instant filterEnd) {
    }
}
