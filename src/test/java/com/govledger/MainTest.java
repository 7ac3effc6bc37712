package com.govledger;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.govledger.trace.TraceDomain;
import com.govledger.trace.TraceNode;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private Path configPath;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(tempDir.resolve("governance"));
        Files.writeString(tempDir.resolve("governance/policy.yaml"), "limit: 100\n");
        configPath = tempDir.resolve("application.yml");
        Files.writeString(configPath, """
                ledger:
                  path: "%1$s/ledger/governance_events.jsonl"
                  maxSizeBytes: 4096
                  maxFileCount: 4
                trace:
                  storePath: "%1$s/trace/trace_links.jsonl"
                audit:
                  maxStalenessSeconds: 3600
                  governanceRoot: "%1$s"
                  governancePaths:
                    - governance
                  outputDir: "%1$s/audit"
                """.formatted(tempDir.toString().replace('\\', '/')));
    }

    @Test
    void shouldRecordLinkExportAndVerify() throws Exception {
        assertEquals(0, run("--mode", "record", "--event-id", "evt-1", "--event-type", "DECISION",
                "--timestamp", "2026-06-01T11:00:00Z", "--agent-id", "agent-7", "--verb", "EXECUTE",
                "--target", "payments/transfer", "--decision", "ALLOW", "--reason-code", "WITHIN_LIMIT",
                "--context", "{\"pac_id\":\"PAC-1\",\"amount\":250}"));
        assertEquals(0, run("--mode", "rotate"));
        assertEquals(0, run("--mode", "status"));
        assertTrue(output().contains("sealed=1/4"), output());
        assertEquals(0, run("--mode", "link", "--from", "DECISION:D1", "--to", "EXECUTION:E1",
                "--link-type", "DECISION_TO_EXECUTION"));
        assertEquals(0, run("--mode", "link", "--from", "EXECUTION:E1", "--to", "SETTLEMENT:S1",
                "--link-type", "EXECUTION_TO_SETTLEMENT"));
        assertEquals(0, run("--mode", "chain", "--entity", "SETTLEMENT:S1"));
        assertTrue(output().contains("link-00000001 EXECUTION:E1 -> SETTLEMENT:S1"), output());

        Path bundle = tempDir.resolve("exported");
        assertEquals(0, run("--mode", "export", "--output", bundle.toString()));
        assertTrue(output().contains("events=1 links=2"), output());
        assertTrue(Files.readString(bundle.resolve("governance_events/events.jsonl")).contains("\"event_id\":\"evt-1\""));

        assertEquals(0, run("--mode", "verify", "--bundle", bundle.toString()));
        assertTrue(output().trim().endsWith("PASS"), output());

        assertEquals(0, run("--mode", "status"));
        assertTrue(output().contains("trace links=2"), output());
    }

    @Test
    void shouldFailVerificationOfTamperedBundle() throws Exception {
        run("--mode", "record", "--event-id", "evt-1", "--event-type", "DENIAL", "--timestamp", "2026-06-01T11:30:00Z");
        Path bundle = tempDir.resolve("exported");
        assertEquals(0, run("--mode", "export", "--output", bundle.toString()));
        Files.writeString(bundle.resolve("governance_events/events.jsonl"), "{}\n");

        assertEquals(1, run("--mode", "verify", "--bundle", bundle.toString()));
        assertTrue(output().contains("ARTIFACT_TAMPERED"), output());
        assertTrue(output().trim().endsWith("FAIL"), output());
    }

    @Test
    void shouldExitWithFailureWhenLinkBreaksTraceInvariant() throws Exception {
        assertEquals(1, run("--mode", "link", "--from", "EXECUTION:X1", "--to", "SETTLEMENT:S9",
                "--link-type", "EXECUTION_TO_SETTLEMENT"));
        assertEquals(0, run("--mode", "status"));
        assertTrue(output().contains("trace links=0"), output());
    }

    @Test
    void shouldExitWithFailureWhenChainHasGaps() throws Exception {
        assertEquals(1, run("--mode", "chain", "--entity", "SETTLEMENT:unknown"));
        assertTrue(output().contains("GAP"), output());
    }

    @Test
    void shouldReturnUsageCodeForMissingOrInvalidArguments() throws Exception {
        assertEquals(2, run());
        assertEquals(2, run("--mode", "record"));
        assertEquals(2, run("--mode", "link", "--from", "nowhere", "--to", "EXECUTION:E1",
                "--link-type", "DECISION_TO_EXECUTION"));
        assertEquals(2, run("--mode", "record", "--event-id", "evt-2", "--event-type", "DECISION",
                "--context", "{\"amount\":\"lots\"}"));
    }

    @Test
    void shouldRefuseToOverwriteExistingBundle() throws Exception {
        Path bundle = Files.createDirectories(tempDir.resolve("exported"));

        assertEquals(3, run("--mode", "export", "--output", bundle.toString()));
    }

    @Test
    void shouldLeaveTraceStoreUntouchedWhenOnlyReading() throws Exception {
        assertEquals(0, run("--mode", "link", "--from", "DECISION:D1", "--to", "EXECUTION:E1",
                "--link-type", "DECISION_TO_EXECUTION"));
        Path store = tempDir.resolve("trace/trace_links.jsonl");
        Files.writeString(store, "{\"decision_ref\":\"D", StandardOpenOption.APPEND);
        long size = Files.size(store);

        assertEquals(0, run("--mode", "status"));
        assertTrue(output().contains("trace links=1"), output());
        run("--mode", "chain", "--entity", "EXECUTION:E1");
        assertEquals(0, run("--mode", "export", "--output", tempDir.resolve("exported").toString()));

        assertEquals(size, Files.size(store));
    }

    @Test
    void shouldParseNodeReferences() {
        assertEquals(new TraceNode(TraceDomain.SETTLEMENT, "S:1"), Main.parseNode("--entity", "settlement:S:1"));
        assertThrows(IllegalArgumentException.class, () -> Main.parseNode("--entity", "LEDGER:"));
        assertThrows(IllegalArgumentException.class, () -> Main.parseNode("--entity", "BANK:b1"));
    }

    private int run(String... args) {
        output = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);
        String[] withConfig = new String[args.length + 2];
        withConfig[0] = "--config";
        withConfig[1] = configPath.toString();
        System.arraycopy(args, 0, withConfig, 2, args.length);
        return new CommandLine(new Main(CLOCK, out)).execute(withConfig);
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }
}
