package com.govledger.trace;

public enum TraceDomain {
    DECISION,
    EXECUTION,
    SETTLEMENT,
    LEDGER
}
