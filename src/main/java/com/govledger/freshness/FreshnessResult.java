package com.govledger.freshness;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record FreshnessResult(
        Instant checkTime,
        long maxStalenessSeconds,
        Map<String, Long> ageSeconds,
        List<FreshnessFailure> failures,
        List<String> errors) {

    public FreshnessResult {
        ageSeconds = Map.copyOf(ageSeconds);
        failures = List.copyOf(failures);
        errors = List.copyOf(errors);
    }

    public boolean passed() {
        return failures.isEmpty() && errors.isEmpty();
    }
}
