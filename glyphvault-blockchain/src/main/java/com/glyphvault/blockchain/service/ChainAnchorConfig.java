package com.glyphvault.blockchain.service;

import com.glyphvault.core.error.ConfigurationException;
import org.web3j.crypto.WalletUtils;

import java.time.Duration;

/**
 * Connection, signing and timing settings for chain anchoring. Endpoint and
 * credentials have no defaults.
 */
public class ChainAnchorConfig {

    private String rpcUrl;
    private String contractAddress;
    private String privateKey;
    private Long chainId;
    private long gasLimit = 200_000L;
    private Long gasPrice; // wei; fetched from the node when unset
    private Duration callTimeout = Duration.ofSeconds(30);
    private Duration receiptPollInterval = Duration.ofSeconds(2);
    private int receiptPollAttempts = 60;
    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(1);

    public String getRpcUrl() { return rpcUrl; }
    public void setRpcUrl(String rpcUrl) { this.rpcUrl = rpcUrl; }
    public String getContractAddress() { return contractAddress; }
    public void setContractAddress(String contractAddress) { this.contractAddress = contractAddress; }
    public String getPrivateKey() { return privateKey; }
    public void setPrivateKey(String privateKey) { this.privateKey = privateKey; }
    public Long getChainId() { return chainId; }
    public void setChainId(Long chainId) { this.chainId = chainId; }
    public long getGasLimit() { return gasLimit; }
    public void setGasLimit(long gasLimit) { this.gasLimit = gasLimit; }
    public Long getGasPrice() { return gasPrice; }
    public void setGasPrice(Long gasPrice) { this.gasPrice = gasPrice; }
    public Duration getCallTimeout() { return callTimeout; }
    public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }
    public Duration getReceiptPollInterval() { return receiptPollInterval; }
    public void setReceiptPollInterval(Duration receiptPollInterval) { this.receiptPollInterval = receiptPollInterval; }
    public int getReceiptPollAttempts() { return receiptPollAttempts; }
    public void setReceiptPollAttempts(int receiptPollAttempts) { this.receiptPollAttempts = receiptPollAttempts; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public Duration getInitialBackoff() { return initialBackoff; }
    public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

    /**
     * Longest a submitted transaction may take to produce a receipt.
     */
    public Duration receiptTimeout() {
        return callTimeout.plus(receiptPollInterval.multipliedBy(receiptPollAttempts));
    }

    /**
     * @throws ConfigurationException naming the first missing or invalid setting
     */
    public void validate() {
        if (isBlank(rpcUrl)) {
            throw new ConfigurationException("Chain RPC URL must be configured");
        }
        if (isBlank(contractAddress)) {
            throw new ConfigurationException("Anchor contract address must be configured");
        }
        if (!WalletUtils.isValidAddress(contractAddress)) {
            throw new ConfigurationException("Anchor contract address is not a valid address: " + contractAddress);
        }
        if (isBlank(privateKey)) {
            throw new ConfigurationException("Chain private key must be configured");
        }
        if (!WalletUtils.isValidPrivateKey(privateKey.trim())) {
            throw new ConfigurationException("Chain private key is not a valid secp256k1 key");
        }
        if (chainId == null || chainId <= 0) {
            throw new ConfigurationException("Chain id must be configured");
        }
        if (gasLimit <= 0) {
            throw new ConfigurationException("Gas limit must be positive");
        }
        if (gasPrice != null && gasPrice <= 0) {
            throw new ConfigurationException("Gas price must be positive when set");
        }
        if (maxAttempts < 1 || receiptPollAttempts < 1) {
            throw new ConfigurationException("Attempt counts must be at least 1");
        }
        if (isNotPositive(callTimeout) || isNotPositive(receiptPollInterval) || isNotPositive(initialBackoff)) {
            throw new ConfigurationException("Timeouts and backoff must be positive durations");
        }
    }

    @Override
    public String toString() {
        return "ChainAnchorConfig[rpcUrl=" + rpcUrl + ", contractAddress=" + contractAddress
                + ", chainId=" + chainId + ", gasLimit=" + gasLimit + ", gasPrice=" + gasPrice + "]";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean isNotPositive(Duration duration) {
        return duration == null || duration.isZero() || duration.isNegative();
    }
}
