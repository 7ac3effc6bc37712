package com.govledger.audit;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExportParameters(
        @JsonProperty("start_time") Instant startTime,
        @JsonProperty("end_time") Instant endTime,
        @JsonProperty("max_staleness_seconds") long maxStalenessSeconds) {
}
