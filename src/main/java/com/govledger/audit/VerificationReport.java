package com.govledger.audit;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

public record VerificationReport(Path bundlePath, Instant verifiedAt, List<CheckResult> checks) {

    public VerificationReport {
        checks = List.copyOf(checks);
    }

    public boolean passed() {
        return !checks.isEmpty() && checks.stream().noneMatch(CheckResult::failed);
    }

    public String verdict() {
        return passed() ? "PASS" : "FAIL";
    }

    public List<CheckResult> failures() {
        return checks.stream().filter(CheckResult::failed).toList();
    }

    public boolean hasFailure(String code) {
        return checks.stream().anyMatch(check -> check.failed() && code.equals(check.code()));
    }
}
