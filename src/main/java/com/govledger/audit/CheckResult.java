package com.govledger.audit;

public record CheckResult(String name, Status status, String code, String detail) {

    public enum Status {
        PASS,
        FAIL,
        SKIPPED
    }

    public static CheckResult pass(String name, String detail) {
        return new CheckResult(name, Status.PASS, null, detail);
    }

    public static CheckResult fail(String name, String code, String detail) {
        return new CheckResult(name, Status.FAIL, code, detail);
    }

    public static CheckResult skipped(String name, String detail) {
        return new CheckResult(name, Status.SKIPPED, null, detail);
    }

    public boolean failed() {
        return status == Status.FAIL;
    }
}
