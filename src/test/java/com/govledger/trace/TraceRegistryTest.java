package com.govledger.trace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.govledger.event.InvalidRecordException;

import static com.govledger.trace.TraceDomain.DECISION;
import static com.govledger.trace.TraceDomain.EXECUTION;
import static com.govledger.trace.TraceDomain.LEDGER;
import static com.govledger.trace.TraceDomain.SETTLEMENT;
import static com.govledger.trace.TraceLinkType.DECISION_TO_EXECUTION;
import static com.govledger.trace.TraceLinkType.DIRECT_REFERENCE;
import static com.govledger.trace.TraceLinkType.EXECUTION_TO_SETTLEMENT;
import static com.govledger.trace.TraceLinkType.SETTLEMENT_TO_LEDGER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TraceRegistryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-01T09:30:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnCompleteChainFromDecisionToSettlement() throws Exception {
        TraceRegistry registry = new TraceRegistry(CLOCK);
        registry.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);
        registry.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT);

        TraceChain chain = registry.getChain(SETTLEMENT, "S1");

        assertEquals(List.of(new TraceNode(DECISION, "D1"), new TraceNode(EXECUTION, "E1"), new TraceNode(SETTLEMENT, "S1")),
                chain.nodes());
        assertEquals(2, chain.links().size());
        assertTrue(chain.gaps().isEmpty());
        assertTrue(chain.complete());
    }

    @Test
    void shouldReportUnknownEntityAsExplicitGap() throws Exception {
        TraceRegistry registry = new TraceRegistry(CLOCK);
        registry.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);

        TraceChain chain = registry.getChain(SETTLEMENT, "S2");

        assertTrue(chain.links().isEmpty());
        assertFalse(chain.complete());
        assertEquals(SETTLEMENT, chain.gaps().get(0).domain());
        assertEquals("S2", chain.gaps().get(0).expectedRef());
    }

    @Test
    void shouldWalkDownstreamFromTheDecision() throws Exception {
        TraceRegistry registry = new TraceRegistry(CLOCK);
        registry.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);
        registry.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT);
        registry.registerLink(SETTLEMENT, "S1", LEDGER, "L1", SETTLEMENT_TO_LEDGER);
        registry.registerLink(DECISION, "D2", EXECUTION, "E2", DECISION_TO_EXECUTION);

        TraceChain chain = registry.getChain(DECISION, "D1");

        assertEquals(3, chain.links().size());
        assertEquals(new TraceNode(LEDGER, "L1"), chain.nodes().get(3));
        assertEquals("D1", chain.links().get(2).decisionRef());
        assertTrue(chain.complete());
    }

    @Test
    void shouldReportSkippedExecutionHop() throws Exception {
        TraceRegistry registry = new TraceRegistry(CLOCK);
        registry.registerLink(DECISION, "D1", SETTLEMENT, "S1", DIRECT_REFERENCE);

        TraceChain chain = registry.getChain(SETTLEMENT, "S1");

        assertEquals(1, chain.gaps().size());
        assertEquals(new Gap(EXECUTION, TraceRegistry.MISSING_REF, chain.gaps().get(0).detail()), chain.gaps().get(0));
    }

    @Test
    void shouldReportChainThatDoesNotStartAtADecision() throws Exception {
        TraceRegistry registry = new TraceRegistry(CLOCK);
        registry.registerLink(EXECUTION, "E5", SETTLEMENT, "S5", EXECUTION_TO_SETTLEMENT, "D5");

        TraceChain chain = registry.getChain(SETTLEMENT, "S5");

        assertEquals(1, chain.gaps().size());
        assertEquals(DECISION, chain.gaps().get(0).domain());
        assertTrue(chain.gaps().get(0).detail().contains("EXECUTION:E5"));
    }

    @Test
    void shouldChainEveryLinkToItsPredecessor() throws Exception {
        TraceRegistry registry = new TraceRegistry(CLOCK);
        TraceLink first = registry.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);
        TraceLink second = registry.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT);

        assertEquals(TraceRegistry.GENESIS_HASH, first.prevHash());
        assertEquals(first.linkHash(), second.prevHash());
        assertEquals(second.linkHash(), registry.headHash());
        assertEquals(second.computeHash(), second.linkHash());
        assertEquals("link-00000001", second.linkId());
        assertTrue(registry.verifyChain().valid());
    }

    @Test
    void shouldReportExactlyTheMutatedIndex() throws Exception {
        TraceRegistry registry = new TraceRegistry(CLOCK);
        for (int i = 0; i < 5; i++) {
            registry.registerLink(DECISION, "D" + i, EXECUTION, "E" + i, DECISION_TO_EXECUTION);
        }
        List<TraceLink> links = new ArrayList<>(registry.links());
        TraceLink original = links.get(2);
        links.set(2, new TraceLink(original.linkId(), original.sequence(), original.fromDomain(), "D99",
                original.toDomain(), original.toRef(), original.linkType(), original.decisionRef(),
                original.registeredAt(), original.prevHash(), original.linkHash()));

        ChainVerification verification = TraceChainVerifier.verify(links, TraceRegistry.GENESIS_HASH);

        assertFalse(verification.valid());
        assertEquals(2, verification.firstInvalidIndex());
        assertTrue(registry.verifyChain().valid());
    }

    @Test
    void shouldRejectSecondDecisionForSettlementAndLeaveRegistryUnchanged() throws Exception {
        TraceRegistry registry = new TraceRegistry(CLOCK);
        registry.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);
        registry.registerLink(DECISION, "D2", EXECUTION, "E2", DECISION_TO_EXECUTION);
        registry.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT);
        String head = registry.headHash();

        TraceInvariantViolationException error = assertThrows(TraceInvariantViolationException.class,
                () -> registry.registerLink(EXECUTION, "E2", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT));

        assertEquals(TraceInvariantViolationException.Rule.SETTLEMENT_FAN_IN, error.rule());
        assertEquals("SETTLEMENT:S1", error.context().get("to"));
        assertEquals(3, registry.size());
        assertEquals(head, registry.headHash());
        assertEquals("D1", registry.decisionOf("S1").orElseThrow());
    }

    @Test
    void shouldAllowSecondExecutionOfSameDecisionIntoSettlement() throws Exception {
        TraceRegistry registry = new TraceRegistry(CLOCK);
        registry.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);
        registry.registerLink(DECISION, "D1", EXECUTION, "E2", DECISION_TO_EXECUTION);
        registry.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT);
        registry.registerLink(EXECUTION, "E2", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT);

        assertEquals(2, registry.linksTo(SETTLEMENT, "S1").size());
        assertEquals(2, registry.linksFrom(DECISION, "D1").size());
    }

    @Test
    void shouldRejectExecutionLinkWithoutDecisionOrigin() {
        TraceRegistry registry = new TraceRegistry(CLOCK);

        TraceInvariantViolationException error = assertThrows(TraceInvariantViolationException.class,
                () -> registry.registerLink(EXECUTION, "E9", SETTLEMENT, "S9", EXECUTION_TO_SETTLEMENT));

        assertEquals(TraceInvariantViolationException.Rule.ORPHAN_LINK, error.rule());
        assertEquals(0, registry.size());
        assertEquals(TraceRegistry.GENESIS_HASH, registry.headHash());
    }

    @Test
    void shouldRejectConflictingAndAmbiguousDecisionReferences() throws Exception {
        TraceRegistry registry = new TraceRegistry(CLOCK);
        registry.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);

        assertEquals(TraceInvariantViolationException.Rule.DECISION_REF_CONFLICT,
                assertThrows(TraceInvariantViolationException.class,
                        () -> registry.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT, "D2"))
                        .rule());

        registry.registerLink(DECISION, "D2", EXECUTION, "E1", DECISION_TO_EXECUTION);
        assertEquals(TraceInvariantViolationException.Rule.AMBIGUOUS_DECISION_ORIGIN,
                assertThrows(TraceInvariantViolationException.class,
                        () -> registry.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT))
                        .rule());
        assertEquals(2, registry.size());
    }

    @Test
    void shouldRejectBlankReferences() {
        TraceRegistry registry = new TraceRegistry(CLOCK);

        InvalidRecordException error = assertThrows(InvalidRecordException.class,
                () -> registry.registerLink(DECISION, " ", EXECUTION, "E1", DECISION_TO_EXECUTION));

        assertEquals("from_ref", error.field());
    }

    @Test
    void shouldReloadPersistedChainAndContinueIt() throws Exception {
        Path store = tempDir.resolve("trace/trace_links.jsonl");
        TraceRegistry registry = TraceRegistry.open(store, CLOCK);
        registry.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);
        registry.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT);
        String head = registry.headHash();

        TraceRegistry reopened = TraceRegistry.open(store, CLOCK);
        assertEquals(2, reopened.size());
        assertEquals(head, reopened.headHash());
        assertEquals("D1", reopened.decisionOf("S1").orElseThrow());

        TraceLink next = reopened.registerLink(SETTLEMENT, "S1", LEDGER, "L1", SETTLEMENT_TO_LEDGER);
        assertEquals(head, next.prevHash());
        assertEquals(3, Files.readAllLines(store).size());
    }

    @Test
    void shouldRefuseToOpenTamperedStore() throws Exception {
        Path store = tempDir.resolve("trace_links.jsonl");
        TraceRegistry registry = TraceRegistry.open(store, CLOCK);
        registry.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);
        registry.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT);

        Files.writeString(store, Files.readString(store).replace("\"from_ref\":\"E1\"", "\"from_ref\":\"E7\""));

        TraceStoreCorruptedException error = assertThrows(TraceStoreCorruptedException.class,
                () -> TraceRegistry.open(store, CLOCK));
        assertEquals(1, error.index());
    }

    @Test
    void shouldRefuseStoreHoldingJsonNullRecord() throws Exception {
        Path store = tempDir.resolve("trace_links.jsonl");
        TraceRegistry.open(store, CLOCK).registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);
        Files.writeString(store, "null\n", StandardOpenOption.APPEND);

        TraceStoreCorruptedException error = assertThrows(TraceStoreCorruptedException.class,
                () -> TraceRegistry.load(store, CLOCK));
        assertEquals(1, error.index());
    }

    @Test
    void shouldLoadReadOnlyWithoutTouchingAnAppendInProgress() throws Exception {
        Path store = tempDir.resolve("trace_links.jsonl");
        TraceRegistry writer = TraceRegistry.open(store, CLOCK);
        writer.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);
        Files.writeString(store, "{\"decision_ref\":\"D", StandardOpenOption.APPEND);
        long size = Files.size(store);

        TraceRegistry reader = TraceRegistry.load(store, CLOCK);

        assertEquals(1, reader.size());
        assertEquals(writer.headHash(), reader.headHash());
        assertEquals(size, Files.size(store));
        assertThrows(IllegalStateException.class,
                () -> reader.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT));
        assertEquals(size, Files.size(store));
    }

    @Test
    void shouldCutTornTailWhenOpenedForWriting() throws Exception {
        Path store = tempDir.resolve("trace_links.jsonl");
        TraceRegistry.open(store, CLOCK).registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION);
        long committed = Files.size(store);
        Files.writeString(store, "{\"decision_ref\":\"D", StandardOpenOption.APPEND);

        TraceRegistry reopened = TraceRegistry.open(store, CLOCK);
        reopened.registerLink(EXECUTION, "E1", SETTLEMENT, "S1", EXECUTION_TO_SETTLEMENT);

        assertTrue(Files.size(store) > committed);
        assertEquals(2, TraceRegistry.load(store, CLOCK).size());
    }

    @Test
    void shouldLeaveRegistryUnchangedWhenStoreCannotBeWritten() throws Exception {
        Path blocker = tempDir.resolve("blocked");
        TraceRegistry registry = TraceRegistry.open(blocker.resolve("trace_links.jsonl"), CLOCK);
        Files.writeString(blocker, "not a directory");

        assertThrows(IOException.class,
                () -> registry.registerLink(DECISION, "D1", EXECUTION, "E1", DECISION_TO_EXECUTION));
        assertEquals(0, registry.size());
        assertEquals(TraceRegistry.GENESIS_HASH, registry.headHash());
    }
}
