package com.govledger.trace;

public enum TraceLinkType {
    PDO_TO_DECISION,
    DECISION_TO_EXECUTION,
    EXECUTION_TO_SETTLEMENT,
    SETTLEMENT_TO_LEDGER,
    DIRECT_REFERENCE
}
