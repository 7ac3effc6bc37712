package com.govledger.freshness;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FreshnessEvaluatorTest {

    private static final Instant CHECK_TIME = Instant.parse("2026-04-01T00:00:00Z");

    @Test
    void shouldPassAtExactlyTheThresholdAndFailOneSecondLater() {
        FreshnessResult atThreshold = FreshnessEvaluator.evaluate(manifest(3600, Map.of(
                "governance_events", CHECK_TIME.minusSeconds(3600))), CHECK_TIME);
        FreshnessResult overThreshold = FreshnessEvaluator.evaluate(manifest(3600, Map.of(
                "governance_events", CHECK_TIME.minusSeconds(3601))), CHECK_TIME);

        assertTrue(atThreshold.passed());
        assertFalse(overThreshold.passed());
        assertEquals(new FreshnessFailure("governance_events", 3601, 3600, 1), overThreshold.failures().get(0));
    }

    @Test
    void shouldNameStaleSourceWithExceededAmount() {
        FreshnessResult result = FreshnessEvaluator.evaluate(manifest(3600, Map.of(
                "trace_links", CHECK_TIME.minusSeconds(4000))), CHECK_TIME);

        assertFalse(result.passed());
        FreshnessFailure failure = result.failures().get(0);
        assertEquals("trace_links", failure.source());
        assertEquals(4000, failure.ageSeconds());
        assertEquals(400, failure.exceededBySeconds());
    }

    @Test
    void shouldJudgeEverySourceIndependently() {
        FreshnessResult result = FreshnessEvaluator.evaluate(manifest(600, Map.of(
                "governance_events", CHECK_TIME.minusSeconds(60),
                "trace_links", CHECK_TIME.minusSeconds(900),
                "governance_fingerprint", CHECK_TIME.minusSeconds(601))), CHECK_TIME);

        assertEquals(3, result.ageSeconds().size());
        assertEquals(2, result.failures().size());
        assertTrue(result.failures().stream().noneMatch(failure -> failure.source().equals("governance_events")));
    }

    @Test
    void shouldTreatFutureTimestampsAsFresh() {
        FreshnessResult result = FreshnessEvaluator.evaluate(manifest(60, Map.of(
                "audit_bundle", CHECK_TIME.plusSeconds(30))), CHECK_TIME);

        assertTrue(result.passed());
        assertEquals(-30L, result.ageSeconds().get("audit_bundle"));
    }

    @Test
    void shouldFailClosedOnIncompleteInput() {
        assertFalse(FreshnessEvaluator.evaluate(manifest(60, Map.of()), CHECK_TIME).passed());
        assertFalse(FreshnessEvaluator.evaluate(manifest(60, Map.of("audit_bundle", CHECK_TIME)), (Instant) null).passed());
        assertFalse(FreshnessEvaluator.evaluate(manifest(-1, Map.of("audit_bundle", CHECK_TIME)), CHECK_TIME).passed());
        assertFalse(FreshnessEvaluator.evaluate(null, CHECK_TIME).passed());
        assertFalse(FreshnessEvaluator.evaluate(FreshnessManifest.of(CHECK_TIME, 60,
                Map.of("audit_bundle", new SourceTimestamp(null, "unset"))), CHECK_TIME).passed());
    }

    private static FreshnessManifest manifest(long maxStalenessSeconds, Map<String, Instant> timestamps) {
        Map<String, SourceTimestamp> sources = new TreeMap<>();
        timestamps.forEach((source, timestamp) -> sources.put(source, new SourceTimestamp(timestamp, source)));
        return FreshnessManifest.of(CHECK_TIME, maxStalenessSeconds, sources);
    }
}
