package com.govledger.audit;

import java.io.IOException;
import java.util.stream.Collectors;

public class ArtifactIntegrityException extends IOException {
    private final transient VerificationReport report;

    public ArtifactIntegrityException(VerificationReport report) {
        super("Bundle " + report.bundlePath() + " failed verification: " + report.failures().stream()
                .map(check -> check.name() + "=" + check.code())
                .collect(Collectors.joining(", ")));
        this.report = report;
    }

    public VerificationReport report() {
        return report;
    }
}
