package com.govledger.freshness;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FreshnessManifest(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("max_staleness_seconds") long maxStalenessSeconds,
        @JsonProperty("source_timestamps") Map<String, SourceTimestamp> sourceTimestamps) {

    public static final String SCHEMA_VERSION = "1.0.0";

    public FreshnessManifest {
        sourceTimestamps = sourceTimestamps == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(sourceTimestamps));
    }

    public static FreshnessManifest of(Instant generatedAt, long maxStalenessSeconds, Map<String, SourceTimestamp> sources) {
        return new FreshnessManifest(SCHEMA_VERSION, generatedAt, maxStalenessSeconds, sources);
    }
}
