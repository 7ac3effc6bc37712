package com.govledger.event;

public class InvalidRecordException extends IllegalArgumentException {
    private final String field;

    public InvalidRecordException(String field, String message) {
        super(field == null ? message : field + ": " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
