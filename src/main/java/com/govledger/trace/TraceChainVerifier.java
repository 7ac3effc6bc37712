package com.govledger.trace;

import java.util.List;

public final class TraceChainVerifier {

    private TraceChainVerifier() {
    }

    public static ChainVerification verify(List<TraceLink> links, String anchorHash) {
        String expectedPrev = anchorHash;
        for (int i = 0; i < links.size(); i++) {
            TraceLink link = links.get(i);
            if (!expectedPrev.equals(link.prevHash())) {
                return ChainVerification.broken(i, "prev_hash of " + link.linkId() + " does not match preceding link_hash", i + 1);
            }
            if (!link.computeHash().equals(link.linkHash())) {
                return ChainVerification.broken(i, "link_hash of " + link.linkId() + " does not match its contents", i + 1);
            }
            expectedPrev = link.linkHash();
        }
        return ChainVerification.intact(links.size());
    }
}
