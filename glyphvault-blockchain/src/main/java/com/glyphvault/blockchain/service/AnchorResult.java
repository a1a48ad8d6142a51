package com.glyphvault.blockchain.service;

import java.math.BigInteger;

/**
 * Outcome of anchoring a batch. {@code txHash}, {@code blockNumber} and
 * {@code gasUsed} are null when the root was already on chain.
 */
public record AnchorResult(
        Status status,
        String root,
        int glyphCount,
        String txHash,
        BigInteger blockNumber,
        BigInteger gasUsed
) {

    public enum Status {
        ANCHORED,
        ALREADY_ANCHORED
    }

    public static AnchorResult alreadyAnchored(String root, int glyphCount) {
        return new AnchorResult(Status.ALREADY_ANCHORED, root, glyphCount, null, null, null);
    }

    public boolean isNewlyAnchored() {
        return status == Status.ANCHORED;
    }
}
