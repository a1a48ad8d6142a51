package com.glyphvault.blockchain.service;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * Calls into the deployed anchor contract. Futures complete exceptionally
 * with the transport error; callers bound them with their own timeouts.
 */
public interface AnchorContractGateway extends AutoCloseable {

    CompletableFuture<Boolean> isAnchored(byte[] root);

    /**
     * Block timestamp at which {@code root} was anchored, zero if never.
     */
    CompletableFuture<BigInteger> anchoredAt(byte[] root);

    /**
     * Signs and broadcasts {@code anchor(root)}. Completes with the
     * transaction hash once the node has accepted it, before it is mined.
     */
    CompletableFuture<String> sendAnchor(byte[] root);

    /**
     * Completes with the receipt of {@code txHash} once it is mined,
     * including a reverted one.
     */
    CompletableFuture<AnchorReceipt> awaitReceipt(String txHash);

    @Override
    default void close() {
    }
}
