package com.govledger.freshness;

public record FreshnessFailure(String source, long ageSeconds, long maxStalenessSeconds, long exceededBySeconds) {
}
