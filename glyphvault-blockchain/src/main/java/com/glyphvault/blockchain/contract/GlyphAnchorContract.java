package com.glyphvault.blockchain.contract;

import org.web3j.abi.EventValues;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Glyph anchor smart contract - Web3j wrapper.
 *
 * <pre>
 * function anchor(bytes32 root)
 * function isAnchored(bytes32 root) view returns (bool)
 * function anchors(bytes32 root) view returns (uint256)   // block timestamp, 0 if absent
 * event Anchored(bytes32 indexed root, uint256 timestamp)
 * </pre>
 */
public class GlyphAnchorContract extends Contract {

    public static final String BINARY = "";
    public static final String FUNC_ANCHOR = "anchor";
    public static final String FUNC_ISANCHORED = "isAnchored";
    public static final String FUNC_ANCHORS = "anchors";

    public static final Event ANCHORED_EVENT = new Event("Anchored",
            Arrays.asList(
                    new TypeReference<Bytes32>(true) {},  // root
                    new TypeReference<Uint256>() {}       // timestamp
            ));

    protected GlyphAnchorContract(String contractAddress, Web3j web3j,
                                  TransactionManager transactionManager, ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, transactionManager, gasProvider);
    }

    /**
     * Call data for {@code anchor(root)}, for transactions sent and tracked
     * outside this wrapper.
     */
    public static String encodeAnchor(byte[] root) {
        final Function function = new Function(
                FUNC_ANCHOR,
                Collections.singletonList(new Bytes32(root)),
                Collections.emptyList());
        return FunctionEncoder.encode(function);
    }

    public RemoteFunctionCall<Boolean> isAnchored(byte[] root) {
        final Function function = new Function(
                FUNC_ISANCHORED,
                Collections.singletonList(new Bytes32(root)),
                Collections.singletonList(new TypeReference<Bool>() {}));
        return executeRemoteCallSingleValueReturn(function, Boolean.class);
    }

    /**
     * Block timestamp at which {@code root} was anchored, zero if never.
     */
    public RemoteFunctionCall<BigInteger> anchors(byte[] root) {
        final Function function = new Function(
                FUNC_ANCHORS,
                Collections.singletonList(new Bytes32(root)),
                Collections.singletonList(new TypeReference<Uint256>() {}));
        return executeRemoteCallSingleValueReturn(function, BigInteger.class);
    }

    /**
     * {@code Anchored} events emitted in a mined transaction.
     */
    public List<AnchoredEvent> getAnchoredEvents(TransactionReceipt receipt) {
        List<AnchoredEvent> events = new ArrayList<>();
        for (Log log : receipt.getLogs()) {
            EventValues values = extractEventParameters(ANCHORED_EVENT, log);
            if (values != null) {
                events.add(new AnchoredEvent(
                        (byte[]) values.getIndexedValues().get(0).getValue(),
                        (BigInteger) values.getNonIndexedValues().get(0).getValue(),
                        log.getTransactionHash()));
            }
        }
        return events;
    }

    public static GlyphAnchorContract load(String contractAddress, Web3j web3j,
                                           TransactionManager transactionManager, ContractGasProvider gasProvider) {
        return new GlyphAnchorContract(contractAddress, web3j, transactionManager, gasProvider);
    }

    public record AnchoredEvent(byte[] root, BigInteger timestamp, String transactionHash) {}
}
