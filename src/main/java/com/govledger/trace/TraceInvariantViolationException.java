package com.govledger.trace;

import java.util.Map;

public class TraceInvariantViolationException extends RuntimeException {
    private final Rule rule;
    private final Map<String, String> context;

    public TraceInvariantViolationException(Rule rule, String message, Map<String, String> context) {
        super(rule + ": " + message);
        this.rule = rule;
        this.context = Map.copyOf(context);
    }

    public Rule rule() {
        return rule;
    }

    public Map<String, String> context() {
        return context;
    }

    public enum Rule {
        SETTLEMENT_FAN_IN,
        ORPHAN_LINK,
        AMBIGUOUS_DECISION_ORIGIN,
        DECISION_REF_CONFLICT
    }
}
