package com.govledger.audit;

import java.nio.file.Path;
import java.time.Instant;

public record ExportRequest(Instant start, Instant end, long maxStalenessSeconds, Path destination) {

    public ExportRequest {
        if (destination == null) {
            throw new IllegalArgumentException("destination is required");
        }
        if (maxStalenessSeconds < 0) {
            throw new IllegalArgumentException("maxStalenessSeconds must not be negative");
        }
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
    }
}
