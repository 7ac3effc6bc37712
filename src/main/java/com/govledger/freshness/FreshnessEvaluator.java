package com.govledger.freshness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class FreshnessEvaluator {

    private FreshnessEvaluator() {
    }

    public static FreshnessResult evaluate(FreshnessManifest manifest, Clock clock) {
        return evaluate(manifest, clock == null ? null : clock.instant());
    }

    public static FreshnessResult evaluate(FreshnessManifest manifest, Instant checkTime) {
        Map<String, Long> ages = new TreeMap<>();
        List<FreshnessFailure> failures = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        if (manifest == null) {
            errors.add("freshness manifest is missing");
            return new FreshnessResult(checkTime, 0, ages, failures, errors);
        }
        long max = manifest.maxStalenessSeconds();
        if (checkTime == null) {
            errors.add("no check time available");
        }
        if (max < 0) {
            errors.add("max_staleness_seconds is negative: " + max);
        }
        if (manifest.sourceTimestamps().isEmpty()) {
            errors.add("manifest declares no sources");
        }
        if (!errors.isEmpty()) {
            return new FreshnessResult(checkTime, max, ages, failures, errors);
        }

        for (Map.Entry<String, SourceTimestamp> entry : manifest.sourceTimestamps().entrySet()) {
            String source = entry.getKey();
            SourceTimestamp observed = entry.getValue();
            if (observed == null || observed.timestamp() == null) {
                errors.add("source " + source + " has no timestamp");
                continue;
            }
            long age = Duration.between(observed.timestamp(), checkTime).getSeconds();
            ages.put(source, age);
            if (age > max) {
                failures.add(new FreshnessFailure(source, age, max, age - max));
            }
        }
        return new FreshnessResult(checkTime, max, ages, failures, errors);
    }
}
