package com.glyphvault.blockchain.service;

import java.math.BigInteger;

/**
 * The parts of a mined transaction receipt the anchoring flow reads.
 */
public record AnchorReceipt(
        String txHash,
        BigInteger blockNumber,
        BigInteger gasUsed,
        boolean statusOk,
        String status
) {}
