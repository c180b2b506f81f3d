package lab.bridge.sim.fakechain;

import lab.bridge.chain.BlockchainService;
import lab.bridge.chain.BridgeContractCounterparty;
import lab.bridge.chain.BridgeContractCounterpartyEvent;
import lab.bridge.chain.BridgeContractInitiator;
import lab.bridge.chain.BridgeContractInitiatorEvent;
import lab.bridge.chain.ContractCallException;
import lab.bridge.chain.ContractCallResult;
import lab.bridge.chain.ContractEvent;
import lab.bridge.domain.transfer.Amount;
import lab.bridge.domain.transfer.BridgeTransferDetails;
import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.ChainAddress;
import lab.bridge.domain.transfer.CounterpartyCompletedDetails;
import lab.bridge.domain.transfer.HashLock;
import lab.bridge.domain.transfer.HashLockPreImage;
import lab.bridge.domain.transfer.LockDetails;
import lab.bridge.domain.transfer.RecipientAddress;
import lab.bridge.domain.transfer.TimeLock;
import lab.bridge.stream.EventSource;
import lab.bridge.stream.MailboxEventSource;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory chain with both bridge contracts. Contract calls take effect immediately and publish the
 * matching event; the outcome of upcoming calls can be scripted to reproduce failures.
 */
@Slf4j
public class FakeChain<A extends ChainAddress> implements BlockchainService<A> {

    public enum NextOutcome {
        SUCCESS,
        FAIL_SYSTEM,
        REJECTED
    }

    public enum InitiatorState {
        INITIATED,
        COMPLETED,
        REFUNDED
    }

    public enum LockState {
        LOCKED,
        COMPLETED,
        ABORTED
    }

    private final String name;
    private final SecureRandom random = new SecureRandom();
    private final MailboxEventSource<ContractEvent<A>> events;

    // Scripted outcomes, consumed one per contract call; SUCCESS once empty.
    private final Deque<NextOutcome> nextOutcomes = new ArrayDeque<>();

    private final Map<BridgeTransferId, BridgeTransferDetails<A>> initiated = new HashMap<>();
    private final Map<BridgeTransferId, InitiatorState> initiatorStates = new HashMap<>();
    private final Map<BridgeTransferId, HashLockPreImage> initiatorSecrets = new HashMap<>();
    private final Map<BridgeTransferId, LockDetails<A>> locks = new HashMap<>();
    private final Map<BridgeTransferId, LockState> lockStates = new HashMap<>();
    private final Map<String, Integer> callCounts = new HashMap<>();

    private final BridgeContractInitiator<A> initiatorContract = new BridgeContractInitiator<>() {
        @Override
        public CompletableFuture<ContractCallResult> completeBridgeTransfer(BridgeTransferId id, HashLockPreImage preImage) {
            return call("initiator.complete", () -> {
                requireInitiatorState(id, InitiatorState.INITIATED);
                initiatorStates.put(id, InitiatorState.COMPLETED);
                initiatorSecrets.put(id, preImage);
                events.publish(new BridgeContractInitiatorEvent.Completed<>(id, preImage));
            });
        }

        @Override
        public CompletableFuture<ContractCallResult> refundBridgeTransfer(BridgeTransferId id) {
            return call("initiator.refund", () -> refundInternal(id));
        }
    };

    private final BridgeContractCounterparty<A> counterpartyContract = new BridgeContractCounterparty<>() {
        @Override
        public CompletableFuture<ContractCallResult> lockBridgeTransfer(LockDetails<A> details) {
            return call("counterparty.lock", () -> {
                if (locks.containsKey(details.bridgeTransferId())) {
                    throw new ContractCallException("lock already exists: " + details.bridgeTransferId());
                }
                locks.put(details.bridgeTransferId(), details);
                lockStates.put(details.bridgeTransferId(), LockState.LOCKED);
                events.publish(new BridgeContractCounterpartyEvent.Locked<>(details));
            });
        }

        @Override
        public CompletableFuture<ContractCallResult> completeBridgeTransfer(BridgeTransferId id, HashLockPreImage preImage) {
            return call("counterparty.complete", () -> claimInternal(id, preImage));
        }

        @Override
        public CompletableFuture<ContractCallResult> abortBridgeTransfer(BridgeTransferId id) {
            return call("counterparty.abort", () -> {
                requireLockState(id, LockState.LOCKED);
                lockStates.put(id, LockState.ABORTED);
            });
        }
    };

    public FakeChain(String name) {
        this.name = name;
        this.events = new MailboxEventSource<>(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public EventSource<ContractEvent<A>> events() {
        return events;
    }

    @Override
    public BridgeContractInitiator<A> initiatorContract() {
        return initiatorContract;
    }

    @Override
    public BridgeContractCounterparty<A> counterpartyContract() {
        return counterpartyContract;
    }

    public synchronized void setNextOutcome(NextOutcome outcome, int times) {
        for (int i = 0; i < times; i++) {
            nextOutcomes.addLast(outcome);
        }
    }

    // User action: start a swap on this chain's initiator contract.
    public synchronized BridgeTransferId initiate(
            A initiator,
            RecipientAddress recipient,
            HashLock hashLock,
            TimeLock timeLock,
            Amount amount
    ) {
        byte[] raw = new byte[BridgeTransferId.LENGTH];
        random.nextBytes(raw);
        BridgeTransferId id = BridgeTransferId.of(raw);
        BridgeTransferDetails<A> details = new BridgeTransferDetails<>(id, initiator, recipient, hashLock, timeLock, amount);
        initiated.put(id, details);
        initiatorStates.put(id, InitiatorState.INITIATED);
        log.info("event=fake_chain.initiate chain={} transferId={} amount={}", name, id, amount.value());
        events.publish(new BridgeContractInitiatorEvent.Initiated<>(details));
        return id;
    }

    // User action: the recipient claims the counterparty lock, revealing the secret.
    public synchronized void claim(BridgeTransferId id, HashLockPreImage preImage) {
        log.info("event=fake_chain.claim chain={} transferId={}", name, id);
        claimInternal(id, preImage);
    }

    // User action: the initiator takes the funds back.
    public synchronized void refund(BridgeTransferId id) {
        log.info("event=fake_chain.refund chain={} transferId={}", name, id);
        refundInternal(id);
    }

    // Delivers the Initiated event of an existing transfer a second time, as a flaky monitor would.
    public synchronized void replayInitiated(BridgeTransferId id) {
        BridgeTransferDetails<A> details = initiated.get(id);
        if (details == null) {
            throw new IllegalArgumentException("unknown transfer on " + name + ": " + id);
        }
        events.publish(new BridgeContractInitiatorEvent.Initiated<>(details));
    }

    // Delivers an arbitrary event, bypassing contract state.
    public void emit(ContractEvent<A> event) {
        events.publish(event);
    }

    public void failEventStream(String reason) {
        events.fail(new IllegalStateException(reason));
    }

    public synchronized Optional<InitiatorState> initiatorState(BridgeTransferId id) {
        return Optional.ofNullable(initiatorStates.get(id));
    }

    public synchronized Optional<HashLockPreImage> claimedSecret(BridgeTransferId id) {
        return Optional.ofNullable(initiatorSecrets.get(id));
    }

    public synchronized Optional<LockDetails<A>> lock(BridgeTransferId id) {
        return Optional.ofNullable(locks.get(id));
    }

    public synchronized Optional<LockState> lockState(BridgeTransferId id) {
        return Optional.ofNullable(lockStates.get(id));
    }

    public synchronized int callCount(String operation) {
        return callCounts.getOrDefault(operation, 0);
    }

    private synchronized CompletableFuture<ContractCallResult> call(String operation, Runnable effect) {
        callCounts.merge(operation, 1, Integer::sum);
        NextOutcome outcome = nextOutcomes.isEmpty() ? NextOutcome.SUCCESS : nextOutcomes.pollFirst();
        log.debug("event=fake_chain.call chain={} operation={} outcome={}", name, operation, outcome);
        if (outcome == NextOutcome.FAIL_SYSTEM) {
            return CompletableFuture.failedFuture(new ContractCallException("simulated failure: " + operation + " on " + name));
        }
        if (outcome == NextOutcome.REJECTED) {
            return CompletableFuture.completedFuture(new ContractCallResult(newTxHash(), false));
        }
        try {
            effect.run();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e instanceof ContractCallException ? e : new ContractCallException(e.getMessage(), e));
        }
        return CompletableFuture.completedFuture(new ContractCallResult(newTxHash(), true));
    }

    private void claimInternal(BridgeTransferId id, HashLockPreImage preImage) {
        requireLockState(id, LockState.LOCKED);
        lockStates.put(id, LockState.COMPLETED);
        events.publish(new BridgeContractCounterpartyEvent.Completed<>(new CounterpartyCompletedDetails(id, preImage)));
    }

    private void refundInternal(BridgeTransferId id) {
        requireInitiatorState(id, InitiatorState.INITIATED);
        initiatorStates.put(id, InitiatorState.REFUNDED);
        events.publish(new BridgeContractInitiatorEvent.Refunded<>(id));
    }

    private void requireInitiatorState(BridgeTransferId id, InitiatorState expected) {
        InitiatorState state = initiatorStates.get(id);
        if (state == null) {
            throw new IllegalArgumentException("unknown transfer on " + name + ": " + id);
        }
        if (state != expected) {
            throw new IllegalStateException("transfer " + id + " is " + state + ", expected " + expected);
        }
    }

    private void requireLockState(BridgeTransferId id, LockState expected) {
        LockState state = lockStates.get(id);
        if (state == null) {
            throw new IllegalArgumentException("no lock on " + name + " for transfer " + id);
        }
        if (state != expected) {
            throw new IllegalStateException("lock " + id + " is " + state + ", expected " + expected);
        }
    }

    private String newTxHash() {
        return "0xFAKE_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
