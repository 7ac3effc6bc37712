package com.govledger.trace;

import java.util.List;

public record TraceChain(TraceDomain domain, String ref, List<TraceLink> links, List<TraceNode> nodes, List<Gap> gaps) {

    public TraceChain {
        links = List.copyOf(links);
        nodes = List.copyOf(nodes);
        gaps = List.copyOf(gaps);
    }

    public boolean complete() {
        return gaps.isEmpty();
    }
}
