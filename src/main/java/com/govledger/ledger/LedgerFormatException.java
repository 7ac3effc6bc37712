package com.govledger.ledger;

import java.io.IOException;

public class LedgerFormatException extends IOException {
    private final String segment;
    private final long lineNumber;

    public LedgerFormatException(String segment, long lineNumber, String message, Throwable cause) {
        super(segment + ":" + lineNumber + ": " + message, cause);
        this.segment = segment;
        this.lineNumber = lineNumber;
    }

    public String segment() {
        return segment;
    }

    public long lineNumber() {
        return lineNumber;
    }
}
