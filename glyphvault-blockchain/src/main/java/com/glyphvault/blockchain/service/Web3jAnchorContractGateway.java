package com.glyphvault.blockchain.service;

import com.glyphvault.blockchain.contract.GlyphAnchorContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.RawTransactionManager;
import org.web3j.tx.gas.ContractGasProvider;
import org.web3j.tx.gas.StaticGasProvider;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.utils.Async;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * {@link AnchorContractGateway} backed by a JSON-RPC node through Web3j.
 * Transactions are signed locally and sent raw; the receipt of a sent hash is
 * polled at the configured interval for at most the configured number of
 * attempts.
 */
public class Web3jAnchorContractGateway implements AnchorContractGateway {

    private static final Logger log = LoggerFactory.getLogger(Web3jAnchorContractGateway.class);

    private final Web3j web3j;
    private final String contractAddress;
    private final RawTransactionManager transactionManager;
    private final PollingTransactionReceiptProcessor receiptProcessor;
    private final ContractGasProvider gasProvider;
    private final GlyphAnchorContract contract;

    public Web3jAnchorContractGateway(ChainAnchorConfig config) {
        this.web3j = Web3j.build(new HttpService(config.getRpcUrl()));
        this.contractAddress = config.getContractAddress();
        Credentials credentials = Credentials.create(config.getPrivateKey().trim());
        this.receiptProcessor = new PollingTransactionReceiptProcessor(
                web3j,
                config.getReceiptPollInterval().toMillis(),
                config.getReceiptPollAttempts());
        this.transactionManager = new RawTransactionManager(web3j, credentials, config.getChainId(), receiptProcessor);
        this.gasProvider = gasProvider(web3j, config);
        this.contract = GlyphAnchorContract.load(contractAddress, web3j, transactionManager, gasProvider);
        log.info("Anchor contract initialized at {} on chain {} (sender {})",
                config.getContractAddress(), config.getChainId(), credentials.getAddress());
    }

    @Override
    public CompletableFuture<Boolean> isAnchored(byte[] root) {
        return contract.isAnchored(root).sendAsync();
    }

    @Override
    public CompletableFuture<BigInteger> anchoredAt(byte[] root) {
        return contract.anchors(root).sendAsync();
    }

    @Override
    public CompletableFuture<String> sendAnchor(byte[] root) {
        return Async.run(() -> {
            EthSendTransaction sent = transactionManager.sendTransaction(
                    gasProvider.getGasPrice(GlyphAnchorContract.FUNC_ANCHOR),
                    gasProvider.getGasLimit(GlyphAnchorContract.FUNC_ANCHOR),
                    contractAddress,
                    GlyphAnchorContract.encodeAnchor(root),
                    BigInteger.ZERO);
            if (sent.hasError()) {
                // rejected by the node (nonce, funds, gas); nothing was broadcast
                throw new ChainException("Anchor transaction rejected: " + sent.getError().getMessage(), false, null);
            }
            log.debug("Anchor transaction {} broadcast", sent.getTransactionHash());
            return sent.getTransactionHash();
        });
    }

    @Override
    public CompletableFuture<AnchorReceipt> awaitReceipt(String txHash) {
        return Async.run(() -> {
            try {
                return toReceipt(receiptProcessor.waitForTransactionReceipt(txHash));
            } catch (TransactionException e) {
                throw new ChainException("No receipt yet for anchor transaction " + txHash,
                        txHash, null, true, e);
            }
        });
    }

    @Override
    public void close() {
        web3j.shutdown();
    }

    private static AnchorReceipt toReceipt(TransactionReceipt receipt) {
        return new AnchorReceipt(
                receipt.getTransactionHash(),
                receipt.getBlockNumber(),
                receipt.getGasUsed(),
                receipt.isStatusOK(),
                receipt.getStatus());
    }

    private static ContractGasProvider gasProvider(Web3j web3j, ChainAnchorConfig config) {
        BigInteger gasLimit = BigInteger.valueOf(config.getGasLimit());
        if (config.getGasPrice() != null) {
            return new StaticGasProvider(BigInteger.valueOf(config.getGasPrice()), gasLimit);
        }
        return new NetworkGasProvider(web3j, gasLimit);
    }

    /**
     * Fixed gas limit, gas price read from the node for every transaction.
     */
    static class NetworkGasProvider extends StaticGasProvider {

        private final Web3j web3j;

        NetworkGasProvider(Web3j web3j, BigInteger gasLimit) {
            super(BigInteger.ZERO, gasLimit);
            this.web3j = web3j;
        }

        @Override
        public BigInteger getGasPrice(String contractFunc) {
            return getGasPrice();
        }

        @Override
        public BigInteger getGasPrice() {
            try {
                return web3j.ethGasPrice().send().getGasPrice();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read gas price from node", e);
            }
        }
    }
}
