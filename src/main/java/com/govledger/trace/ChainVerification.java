package com.govledger.trace;

public record ChainVerification(boolean valid, int firstInvalidIndex, String reason, int linksChecked) {

    public static ChainVerification intact(int linksChecked) {
        return new ChainVerification(true, -1, "valid", linksChecked);
    }

    public static ChainVerification broken(int index, String reason, int linksChecked) {
        return new ChainVerification(false, index, reason, linksChecked);
    }
}
