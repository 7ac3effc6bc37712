package com.govledger.trace;

import java.io.IOException;

public class TraceStoreCorruptedException extends IOException {
    private final int index;

    public TraceStoreCorruptedException(String message, int index) {
        super(message);
        this.index = index;
    }

    public TraceStoreCorruptedException(String message, int index, Throwable cause) {
        super(message, cause);
        this.index = index;
    }

    public int index() {
        return index;
    }
}
