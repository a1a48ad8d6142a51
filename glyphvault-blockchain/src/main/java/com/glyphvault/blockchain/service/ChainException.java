package com.glyphvault.blockchain.service;

import com.glyphvault.core.error.GlyphVaultException;

/**
 * A chain call failed. Timeouts and transport errors are retryable; a
 * reverted transaction is not.
 */
public class ChainException extends GlyphVaultException {

    private final String transactionHash;
    private final String status;
    private final boolean retryable;

    public ChainException(String message, boolean retryable, Throwable cause) {
        this(message, null, null, retryable, cause);
    }

    public ChainException(String message, String transactionHash, String status, boolean retryable, Throwable cause) {
        super(message, cause);
        this.transactionHash = transactionHash;
        this.status = status;
        this.retryable = retryable;
    }

    public static ChainException reverted(String transactionHash, String status) {
        return new ChainException("Anchor transaction " + transactionHash + " reverted with status " + status,
                transactionHash, status, false, null);
    }

    public String getTransactionHash() {
        return transactionHash;
    }

    public String getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
