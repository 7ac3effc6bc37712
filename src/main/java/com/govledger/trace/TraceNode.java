package com.govledger.trace;

public record TraceNode(TraceDomain domain, String ref) {

    @Override
    public String toString() {
        return domain + ":" + ref;
    }
}
