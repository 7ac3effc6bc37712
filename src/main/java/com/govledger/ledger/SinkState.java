package com.govledger.ledger;

public enum SinkState {
    ACTIVE,
    FAILED,
    CLOSED
}
