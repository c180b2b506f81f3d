package lab.bridge.adapter.evm;

import lab.bridge.chain.BridgeContractCounterpartyEvent;
import lab.bridge.chain.BridgeContractInitiatorEvent;
import lab.bridge.chain.ContractCallException;
import lab.bridge.domain.transfer.Amount;
import lab.bridge.domain.transfer.BridgeTransferDetails;
import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.CounterpartyCompletedDetails;
import lab.bridge.domain.transfer.EvmAddress;
import lab.bridge.domain.transfer.HashLock;
import lab.bridge.domain.transfer.HashLockPreImage;
import lab.bridge.domain.transfer.InitiatorAddress;
import lab.bridge.domain.transfer.LockDetails;
import lab.bridge.domain.transfer.RecipientAddress;
import lab.bridge.domain.transfer.TimeLock;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * ABI of the two bridge contracts deployed on the EVM chain.
 *
 * <p>Initiator contract:
 * <pre>
 * event BridgeTransferInitiated(bytes32 indexed bridgeTransferId, address indexed initiator,
 *         bytes32 indexed recipient, bytes32 hashLock, uint256 timeLock, uint256 amount)
 * event BridgeTransferCompleted(bytes32 indexed bridgeTransferId, bytes32 preImage)
 * event BridgeTransferRefunded(bytes32 indexed bridgeTransferId)
 * function completeBridgeTransfer(bytes32 bridgeTransferId, bytes32 preImage)
 * function refundBridgeTransfer(bytes32 bridgeTransferId)
 * </pre>
 *
 * <p>Counterparty contract:
 * <pre>
 * event BridgeTransferLocked(bytes32 indexed bridgeTransferId, bytes32 indexed initiator,
 *         address indexed recipient, bytes32 hashLock, uint256 timeLock, uint256 amount)
 * event BridgeTransferCompleted(bytes32 indexed bridgeTransferId, bytes32 preImage)
 * function lockBridgeTransfer(bytes32 initiator, bytes32 bridgeTransferId, bytes32 hashLock,
 *         uint256 timeLock, address recipient, uint256 amount)
 * function completeBridgeTransfer(bytes32 bridgeTransferId, bytes32 preImage)
 * function abortBridgeTransfer(bytes32 bridgeTransferId)
 * </pre>
 * Both contracts emit {@code BridgeTransferCompleted} with the same signature; the emitting address
 * tells them apart.
 */
public final class EvmBridgeAbi {

    private static final int WORD = 32;

    public static final Event BRIDGE_TRANSFER_INITIATED = new Event("BridgeTransferInitiated", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Bytes32>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}
    ));

    public static final Event BRIDGE_TRANSFER_COMPLETED = new Event("BridgeTransferCompleted", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Bytes32>() {}
    ));

    public static final Event BRIDGE_TRANSFER_REFUNDED = new Event("BridgeTransferRefunded", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {}
    ));

    public static final Event BRIDGE_TRANSFER_LOCKED = new Event("BridgeTransferLocked", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Bytes32>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}
    ));

    public static final String INITIATED_TOPIC = EventEncoder.encode(BRIDGE_TRANSFER_INITIATED);
    public static final String COMPLETED_TOPIC = EventEncoder.encode(BRIDGE_TRANSFER_COMPLETED);
    public static final String REFUNDED_TOPIC = EventEncoder.encode(BRIDGE_TRANSFER_REFUNDED);
    public static final String LOCKED_TOPIC = EventEncoder.encode(BRIDGE_TRANSFER_LOCKED);

    private EvmBridgeAbi() {
    }

    /**
     * @return empty for logs of events the relayer does not consume
     * @throws EvmEventDecodingException if a bridge event log is malformed
     */
    public static Optional<BridgeContractInitiatorEvent<EvmAddress>> decodeInitiatorLog(Log log) {
        String topic = eventTopic(log);
        if (INITIATED_TOPIC.equalsIgnoreCase(topic)) {
            List<Type> values = nonIndexed(log, BRIDGE_TRANSFER_INITIATED);
            byte[] initiatorWord = topicWord(log, 2);
            return Optional.of(new BridgeContractInitiatorEvent.Initiated<>(new BridgeTransferDetails<>(
                    BridgeTransferId.of(topicWord(log, 1)),
                    EvmAddress.of(Arrays.copyOfRange(initiatorWord, WORD - EvmAddress.LENGTH, WORD)),
                    RecipientAddress.of(topicWord(log, 3)),
                    HashLock.of(((Bytes32) values.get(0)).getValue()),
                    timeLock(log, (Uint256) values.get(1)),
                    new Amount(((Uint256) values.get(2)).getValue())
            )));
        }
        if (COMPLETED_TOPIC.equalsIgnoreCase(topic)) {
            List<Type> values = nonIndexed(log, BRIDGE_TRANSFER_COMPLETED);
            return Optional.of(new BridgeContractInitiatorEvent.Completed<>(
                    BridgeTransferId.of(topicWord(log, 1)),
                    HashLockPreImage.of(((Bytes32) values.get(0)).getValue())
            ));
        }
        if (REFUNDED_TOPIC.equalsIgnoreCase(topic)) {
            return Optional.of(new BridgeContractInitiatorEvent.Refunded<>(BridgeTransferId.of(topicWord(log, 1))));
        }
        return Optional.empty();
    }

    /**
     * @return empty for logs of events the relayer does not consume
     * @throws EvmEventDecodingException if a bridge event log is malformed
     */
    public static Optional<BridgeContractCounterpartyEvent<EvmAddress>> decodeCounterpartyLog(Log log) {
        String topic = eventTopic(log);
        if (LOCKED_TOPIC.equalsIgnoreCase(topic)) {
            List<Type> values = nonIndexed(log, BRIDGE_TRANSFER_LOCKED);
            byte[] recipientWord = topicWord(log, 3);
            return Optional.of(new BridgeContractCounterpartyEvent.Locked<>(new LockDetails<>(
                    BridgeTransferId.of(topicWord(log, 1)),
                    InitiatorAddress.of(topicWord(log, 2)),
                    EvmAddress.of(Arrays.copyOfRange(recipientWord, WORD - EvmAddress.LENGTH, WORD)),
                    HashLock.of(((Bytes32) values.get(0)).getValue()),
                    timeLock(log, (Uint256) values.get(1)),
                    new Amount(((Uint256) values.get(2)).getValue())
            )));
        }
        if (COMPLETED_TOPIC.equalsIgnoreCase(topic)) {
            List<Type> values = nonIndexed(log, BRIDGE_TRANSFER_COMPLETED);
            return Optional.of(new BridgeContractCounterpartyEvent.Completed<>(new CounterpartyCompletedDetails(
                    BridgeTransferId.of(topicWord(log, 1)),
                    HashLockPreImage.of(((Bytes32) values.get(0)).getValue())
            )));
        }
        return Optional.empty();
    }

    public static Function completeBridgeTransfer(BridgeTransferId id, HashLockPreImage preImage) {
        byte[] secret = preImage.toBytes();
        if (secret.length != WORD) {
            throw new ContractCallException("pre-image must be " + WORD + " bytes for the EVM contract, got " + secret.length);
        }
        return function("completeBridgeTransfer", new Bytes32(id.toBytes()), new Bytes32(secret));
    }

    public static Function refundBridgeTransfer(BridgeTransferId id) {
        return function("refundBridgeTransfer", new Bytes32(id.toBytes()));
    }

    public static Function lockBridgeTransfer(LockDetails<EvmAddress> details) {
        return function(
                "lockBridgeTransfer",
                new Bytes32(toWord(details.initiatorAddress().toBytes())),
                new Bytes32(details.bridgeTransferId().toBytes()),
                new Bytes32(details.hashLock().toBytes()),
                new Uint256(BigInteger.valueOf(details.timeLock().seconds())),
                new Address(Numeric.toHexString(details.recipientAddress().toBytes())),
                new Uint256(details.amount().value())
        );
    }

    public static Function abortBridgeTransfer(BridgeTransferId id) {
        return function("abortBridgeTransfer", new Bytes32(id.toBytes()));
    }

    private static Function function(String name, Type... inputs) {
        return new Function(name, Arrays.<Type>asList(inputs), Collections.emptyList());
    }

    private static byte[] toWord(byte[] raw) {
        if (raw.length > WORD) {
            throw new ContractCallException("value of " + raw.length + " bytes does not fit a bytes32 argument");
        }
        byte[] word = new byte[WORD];
        System.arraycopy(raw, 0, word, WORD - raw.length, raw.length);
        return word;
    }

    private static String eventTopic(Log log) {
        List<String> topics = log.getTopics();
        if (topics == null || topics.isEmpty()) {
            throw new EvmEventDecodingException("log without topics at tx " + log.getTransactionHash());
        }
        return topics.get(0);
    }

    private static byte[] topicWord(Log log, int index) {
        List<String> topics = log.getTopics();
        if (topics.size() <= index) {
            throw new EvmEventDecodingException("missing topic " + index + " in log at tx " + log.getTransactionHash());
        }
        byte[] word = Numeric.hexStringToByteArray(topics.get(index));
        if (word.length != WORD) {
            throw new EvmEventDecodingException("topic " + index + " is " + word.length + " bytes in log at tx " + log.getTransactionHash());
        }
        return word;
    }

    private static List<Type> nonIndexed(Log log, Event event) {
        List<Type> values;
        try {
            values = FunctionReturnDecoder.decode(log.getData(), event.getNonIndexedParameters());
        } catch (RuntimeException e) {
            throw new EvmEventDecodingException("cannot decode " + event.getName() + " data at tx " + log.getTransactionHash(), e);
        }
        if (values == null || values.size() != event.getNonIndexedParameters().size()) {
            throw new EvmEventDecodingException("unexpected " + event.getName() + " data layout at tx " + log.getTransactionHash());
        }
        return values;
    }

    private static TimeLock timeLock(Log log, Uint256 value) {
        try {
            return TimeLock.of(value.getValue().longValueExact());
        } catch (ArithmeticException e) {
            throw new EvmEventDecodingException("time lock out of range at tx " + log.getTransactionHash(), e);
        }
    }
}
