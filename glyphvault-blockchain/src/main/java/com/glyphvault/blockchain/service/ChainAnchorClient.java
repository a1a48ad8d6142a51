package com.glyphvault.blockchain.service;

import com.glyphvault.core.merkle.MerkleAnchorEngine;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Anchors Merkle roots of glyph batches on chain.
 *
 * Every call is bounded by the configured timeouts. Timeouts and transport
 * errors are retried with exponential backoff. Before anything is sent an
 * attempt asks the contract whether the root is already anchored. Once a
 * transaction has been broadcast its hash is kept and later attempts only
 * wait for that hash's receipt; a slow receipt never leads to a second
 * transaction. A reverted transaction is not retried.
 */
public class ChainAnchorClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChainAnchorClient.class);
    private static final int ROOT_LENGTH = 32;

    private final ChainAnchorConfig config;
    private final AnchorContractGateway gateway;
    private final MerkleAnchorEngine engine;
    private final Retry retry;

    public ChainAnchorClient(ChainAnchorConfig config, AnchorContractGateway gateway, MerkleAnchorEngine engine) {
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.retry = Retry.of("chain-anchor", RetryConfig.custom()
                .maxAttempts(config.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(config.getInitialBackoff(), 2.0))
                .retryOnException(e -> e instanceof ChainException chainError && chainError.isRetryable())
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn("Chain call failed (attempt {}), retrying in {}: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()));
    }

    /**
     * Client talking to the node at {@code config.rpcUrl}. The configuration
     * is validated before any connection is set up.
     *
     * @throws com.glyphvault.core.error.ConfigurationException on missing or invalid settings
     */
    public static ChainAnchorClient connect(ChainAnchorConfig config) {
        Objects.requireNonNull(config, "config").validate();
        return new ChainAnchorClient(config, new Web3jAnchorContractGateway(config), new MerkleAnchorEngine());
    }

    /**
     * Anchors the Merkle root of {@code ids}.
     *
     * @return {@code ANCHORED} with the receipt details, or {@code ALREADY_ANCHORED}
     *         when the root is on chain and no transaction was sent
     * @throws ChainException when the transaction reverted or retries ran out;
     *         carries the transaction hash once one was broadcast
     * @throws IllegalArgumentException when {@code ids} is empty or holds a non glyph id
     */
    public AnchorResult anchor(List<String> ids) {
        Objects.requireNonNull(ids, "ids");
        String root = engine.root(ids);
        byte[] rootBytes = parseRoot(root);
        AtomicReference<String> sentTx = new AtomicReference<>();
        return retry.executeSupplier(() -> attemptAnchor(root, rootBytes, ids.size(), sentTx));
    }

    /**
     * Runs {@link #anchor(List)} on {@code executor}. Cancelling the returned
     * future with interruption aborts the pending wait; a transaction already
     * sent may still be mined.
     */
    public Future<AnchorResult> anchorAsync(List<String> ids, ExecutorService executor) {
        Objects.requireNonNull(executor, "executor");
        List<String> batch = List.copyOf(ids);
        return executor.submit(() -> anchor(batch));
    }

    /**
     * @throws IllegalArgumentException when {@code root} is not 32 bytes of {@code 0x} hex
     */
    public AnchorStatus isAnchored(String root) {
        byte[] rootBytes = parseRoot(root);
        return retry.executeSupplier(() -> {
            boolean anchored = Boolean.TRUE.equals(await(gateway.isAnchored(rootBytes), config.getCallTimeout(), "isAnchored"));
            if (!anchored) {
                return new AnchorStatus(root, false, null);
            }
            BigInteger timestamp = await(gateway.anchoredAt(rootBytes), config.getCallTimeout(), "anchors");
            return new AnchorStatus(root, true,
                    timestamp == null || timestamp.signum() == 0 ? null : Instant.ofEpochSecond(timestamp.longValueExact()));
        });
    }

    /**
     * Offline inclusion check; no chain access.
     */
    public boolean verifyProof(String root, String glyphId, List<String> proof) {
        return engine.verify(root, glyphId, proof);
    }

    @Override
    public void close() {
        gateway.close();
    }

    private AnchorResult attemptAnchor(String root, byte[] rootBytes, int glyphCount, AtomicReference<String> sentTx) {
        String txHash = sentTx.get();
        if (txHash == null) {
            if (Boolean.TRUE.equals(await(gateway.isAnchored(rootBytes), config.getCallTimeout(), "isAnchored"))) {
                log.info("Merkle root {} already anchored, no transaction sent", root);
                return AnchorResult.alreadyAnchored(root, glyphCount);
            }
            log.debug("Sending anchor transaction for root {} ({} glyphs)", root, glyphCount);
            txHash = await(gateway.sendAnchor(rootBytes), config.getCallTimeout(), "anchor");
            sentTx.set(txHash);
        } else {
            log.info("Waiting again for receipt of anchor transaction {}", txHash);
        }
        AnchorReceipt receipt = awaitReceipt(txHash);
        if (!receipt.statusOk()) {
            log.error("Anchor transaction {} for root {} reverted with status {}", receipt.txHash(), root, receipt.status());
            throw ChainException.reverted(receipt.txHash(), receipt.status());
        }
        log.info("Anchored Merkle root {} ({} glyphs) in tx {} at block {}",
                root, glyphCount, receipt.txHash(), receipt.blockNumber());
        return new AnchorResult(AnchorResult.Status.ANCHORED, root, glyphCount,
                receipt.txHash(), receipt.blockNumber(), receipt.gasUsed());
    }

    private AnchorReceipt awaitReceipt(String txHash) {
        try {
            return await(gateway.awaitReceipt(txHash), config.receiptTimeout(), "receipt of " + txHash);
        } catch (ChainException e) {
            if (e.getTransactionHash() != null) {
                throw e;
            }
            throw new ChainException(e.getMessage(), txHash, e.getStatus(), e.isRetryable(), e);
        }
    }

    private static <T> T await(CompletableFuture<T> future, Duration timeout, String call) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ChainException(call + " timed out after " + timeout, true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ChainException(call + " interrupted", false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof ChainException chainError) {
                throw chainError;
            }
            boolean retryable = cause instanceof IOException
                    || cause instanceof UncheckedIOException
                    || cause instanceof TimeoutException;
            throw new ChainException(call + " failed: " + cause.getMessage(), retryable, cause);
        }
    }

    private static byte[] parseRoot(String root) {
        if (root == null || !root.startsWith("0x") || root.length() != 2 + ROOT_LENGTH * 2) {
            throw new IllegalArgumentException("Merkle root must be 0x followed by 64 hex digits: " + root);
        }
        try {
            return HexFormat.of().parseHex(root, 2, root.length());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Merkle root is not valid hex: " + root, e);
        }
    }
}
