package com.govledger.freshness;

import java.time.Instant;

public record SourceTimestamp(Instant timestamp, String description) {
}
