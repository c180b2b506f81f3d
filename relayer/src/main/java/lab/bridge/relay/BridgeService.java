package lab.bridge.relay;

import lab.bridge.chain.BlockchainService;
import lab.bridge.chain.BridgeChainPair;
import lab.bridge.chain.BridgeContractCounterpartyEvent;
import lab.bridge.chain.BridgeContractInitiatorEvent;
import lab.bridge.chain.ContractEvent;
import lab.bridge.domain.transfer.BridgeTransferDetails;
import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.ChainAddress;
import lab.bridge.stream.EventSource;
import lab.bridge.stream.EventStreamException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;

/**
 * Relays atomic swaps between two chains.
 *
 * <p>Each call to {@link #poll()} is one scheduling turn. The four upstream sources are visited in a
 * fixed order: B1->B2 tracker progress, B2->B1 tracker progress, chain one events, chain two events.
 * Items that produce no output (traced-only events) are consumed and the visit continues; the first
 * item that produces output ends the turn. An empty result means nothing was ready; the service never
 * ends on its own. Polling never blocks.
 *
 * <p>Not thread-safe: a single driver ({@link BridgeRelayRunner}) polls it.
 */
@Slf4j
public class BridgeService<A1 extends ChainAddress, A2 extends ChainAddress> {

    static final String MDC_TRANSFER_ID_KEY = "transferId";
    static final String MDC_RELAY_SOURCE_KEY = "relaySource";

    private final BlockchainService<A1> blockchainOne;
    private final BlockchainService<A2> blockchainTwo;
    private final ActiveSwapTracker<A1, A2> activeSwapsOneToTwo;
    private final ActiveSwapTracker<A2, A1> activeSwapsTwoToOne;
    private final boolean reverseDirectionEnabled;
    private final Clock clock;

    public BridgeService(
            BlockchainService<A1> blockchainOne,
            BlockchainService<A2> blockchainTwo,
            BridgeChainPair<A1, A2> chainPair,
            RetryPolicy retryPolicy,
            boolean reverseDirectionEnabled,
            Clock clock
    ) {
        this.blockchainOne = blockchainOne;
        this.blockchainTwo = blockchainTwo;
        this.activeSwapsOneToTwo = new ActiveSwapTracker<>(
                SwapDirection.B1_TO_B2,
                blockchainOne.initiatorContract(),
                blockchainTwo.counterpartyContract(),
                chainPair.oneToTwo(),
                retryPolicy,
                clock
        );
        this.activeSwapsTwoToOne = new ActiveSwapTracker<>(
                SwapDirection.B2_TO_B1,
                blockchainTwo.initiatorContract(),
                blockchainOne.counterpartyContract(),
                chainPair.twoToOne(),
                retryPolicy,
                clock
        );
        this.reverseDirectionEnabled = reverseDirectionEnabled;
        this.clock = clock;
    }

    public ActiveSwapTracker<A1, A2> activeSwapsOneToTwo() {
        return activeSwapsOneToTwo;
    }

    public ActiveSwapTracker<A2, A1> activeSwapsTwoToOne() {
        return activeSwapsTwoToOne;
    }

    /**
     * Registers a callback fired whenever any of the four sources may have new data.
     */
    public void onReady(Runnable listener) {
        activeSwapsOneToTwo.events().onReady(listener);
        activeSwapsTwoToOne.events().onReady(listener);
        blockchainOne.events().onReady(listener);
        blockchainTwo.events().onReady(listener);
    }

    public Optional<BridgeEvent> poll() {
        Optional<BridgeEvent> output = drain(activeSwapsOneToTwo.events(), SwapDirection.B1_TO_B2.label(),
                event -> onActiveSwapEvent(SwapDirection.B1_TO_B2, event));
        if (output.isPresent()) {
            return output;
        }

        output = drain(activeSwapsTwoToOne.events(), SwapDirection.B2_TO_B1.label(),
                event -> onActiveSwapEvent(SwapDirection.B2_TO_B1, event));
        if (output.isPresent()) {
            return output;
        }

        output = drainChain(blockchainOne, this::onBlockchainOneEvent);
        if (output.isPresent()) {
            return output;
        }

        return drainChain(blockchainTwo, this::onBlockchainTwoEvent);
    }

    private <T> Optional<BridgeEvent> drain(EventSource<T> source, String sourceName, Function<T, Optional<BridgeEvent>> handler) {
        Optional<T> next = source.poll();
        while (next.isPresent()) {
            T item = next.get();
            if (item instanceof ContractEvent<?> contractEvent) {
                MDC.put(MDC_TRANSFER_ID_KEY, contractEvent.bridgeTransferId().toHex());
            } else if (item instanceof ActiveSwapEvent swapEvent) {
                MDC.put(MDC_TRANSFER_ID_KEY, swapEvent.bridgeTransferId().toHex());
            }
            MDC.put(MDC_RELAY_SOURCE_KEY, sourceName);
            try {
                Optional<BridgeEvent> output = handler.apply(item);
                if (output.isPresent()) {
                    return output;
                }
            } finally {
                MDC.remove(MDC_TRANSFER_ID_KEY);
                MDC.remove(MDC_RELAY_SOURCE_KEY);
            }
            next = source.poll();
        }
        log.trace("event=bridge_service.source.idle source={}", sourceName);
        return Optional.empty();
    }

    // A decode failure ends one chain's feed; the other chain and both trackers keep running.
    private <A extends ChainAddress> Optional<BridgeEvent> drainChain(
            BlockchainService<A> blockchain,
            Function<ContractEvent<A>, Optional<BridgeEvent>> handler
    ) {
        if (blockchain.events().isTerminated()) {
            return Optional.empty();
        }
        try {
            return drain(blockchain.events(), blockchain.name(), handler);
        } catch (EventStreamException e) {
            log.error("event=bridge_service.source.terminated source={} reason={}", blockchain.name(), e.getMessage(), e);
            return Optional.of(new BridgeWarning(
                    WarningKind.SOURCE_TERMINATED,
                    WarningSeverity.CRITICAL,
                    blockchain.name(),
                    null,
                    null,
                    e.getMessage(),
                    clock.instant()
            ));
        }
    }

    private Optional<BridgeEvent> onActiveSwapEvent(SwapDirection direction, ActiveSwapEvent event) {
        log.trace("event=bridge_service.active_swap_event direction={} outcome={}", direction.label(), event);
        if (event instanceof ActiveSwapEvent.AssetsLockingError lockingError) {
            log.warn("event=bridge_service.locking_error direction={} transferId={} attempts={} reason={}",
                    direction.label(), lockingError.bridgeTransferId(), lockingError.error().attempts(), lockingError.error().reason());
            return Optional.of(callFailure(WarningKind.LOCKING_FAILED, direction, lockingError.error()));
        }
        if (event instanceof ActiveSwapEvent.AssetsCompletingError completingError) {
            log.warn("event=bridge_service.completing_error direction={} transferId={} attempts={} reason={}",
                    direction.label(), completingError.bridgeTransferId(), completingError.error().attempts(), completingError.error().reason());
            return Optional.of(callFailure(WarningKind.COMPLETING_FAILED, direction, completingError.error()));
        }
        if (event instanceof ActiveSwapEvent.AssetsAbortingError abortingError) {
            log.warn("event=bridge_service.aborting_error direction={} transferId={} attempts={} reason={}",
                    direction.label(), abortingError.bridgeTransferId(), abortingError.error().attempts(), abortingError.error().reason());
            return Optional.of(callFailure(WarningKind.ABORTING_FAILED, direction, abortingError.error()));
        }
        // Locked/Completed here only means the call went through; the chain confirms it with its own event.
        log.debug("event=bridge_service.call_succeeded direction={} transferId={} outcome={}",
                direction.label(), event.bridgeTransferId(), event.getClass().getSimpleName());
        return Optional.of(new SwapProgressReported(direction, event, clock.instant()));
    }

    private Optional<BridgeEvent> onBlockchainOneEvent(ContractEvent<A1> event) {
        if (event instanceof BridgeContractInitiatorEvent<A1> initiatorEvent) {
            return onInitiatorEvent(EventOrigin.B1I, initiatorEvent, activeSwapsOneToTwo);
        }
        if (reverseDirectionEnabled && event instanceof BridgeContractCounterpartyEvent<A1> counterpartyEvent) {
            return onCounterpartyEvent(EventOrigin.B1C, counterpartyEvent, activeSwapsTwoToOne);
        }
        log.trace("event=bridge_service.ignored source={} transferId={} contractEvent={}",
                blockchainOne.name(), event.bridgeTransferId(), event.getClass().getSimpleName());
        return Optional.empty();
    }

    private Optional<BridgeEvent> onBlockchainTwoEvent(ContractEvent<A2> event) {
        if (event instanceof BridgeContractCounterpartyEvent<A2> counterpartyEvent) {
            return onCounterpartyEvent(EventOrigin.B2C, counterpartyEvent, activeSwapsOneToTwo);
        }
        if (reverseDirectionEnabled && event instanceof BridgeContractInitiatorEvent<A2> initiatorEvent) {
            return onInitiatorEvent(EventOrigin.B2I, initiatorEvent, activeSwapsTwoToOne);
        }
        log.trace("event=bridge_service.ignored source={} transferId={} contractEvent={}",
                blockchainTwo.name(), event.bridgeTransferId(), event.getClass().getSimpleName());
        return Optional.empty();
    }

    private <S extends ChainAddress, D extends ChainAddress> Optional<BridgeEvent> onInitiatorEvent(
            EventOrigin origin,
            BridgeContractInitiatorEvent<S> event,
            ActiveSwapTracker<S, D> tracker
    ) {
        if (event instanceof BridgeContractInitiatorEvent.Initiated<S> initiated) {
            BridgeTransferDetails<S> details = initiated.details();
            BridgeTransferId id = details.bridgeTransferId();
            if (tracker.alreadyExecuting(id)) {
                return Optional.of(alreadyPresent(origin, tracker, details));
            }
            tracker.startBridgeTransfer(details);
            log.info("event=bridge_service.initiated.registered origin={} transferId={} amount={}", origin, id, details.amount().value());
            return Optional.of(observed(origin, event));
        }

        if (event instanceof BridgeContractInitiatorEvent.Refunded<S> refunded) {
            BridgeTransferId id = refunded.bridgeTransferId();
            if (tracker.alreadyExecuting(id)) {
                log.info("event=bridge_service.refunded.abort_lock origin={} transferId={}", origin, id);
                tracker.abortBridgeTransfer(id);
            } else {
                log.info("event=bridge_service.refunded.untracked origin={} transferId={}", origin, id);
            }
            return Optional.of(observed(origin, event));
        }

        // Completed: the relayer's own claim landed on the initiator chain.
        log.info("event=bridge_service.initiator_completed origin={} transferId={}", origin, event.bridgeTransferId());
        return Optional.of(observed(origin, event));
    }

    private <S extends ChainAddress, D extends ChainAddress> Optional<BridgeEvent> onCounterpartyEvent(
            EventOrigin origin,
            BridgeContractCounterpartyEvent<D> event,
            ActiveSwapTracker<S, D> tracker
    ) {
        if (event instanceof BridgeContractCounterpartyEvent.Completed<D> completed) {
            try {
                tracker.completeBridgeTransfer(completed.details());
                log.info("event=bridge_service.counterparty_completed.claim_dispatched origin={} transferId={}", origin, completed.bridgeTransferId());
                return Optional.of(observed(origin, event));
            } catch (NonExistingSwapException e) {
                // Funds stay locked on the initiator side until someone claims them by hand with this secret.
                log.error("event=bridge_service.counterparty_completed.unknown_swap origin={} transferId={} direction={}",
                        origin, completed.bridgeTransferId(), tracker.direction().label());
                return Optional.of(new BridgeWarning(
                        WarningKind.CANNOT_COMPLETE_UNEXISTING_SWAP,
                        WarningSeverity.CRITICAL,
                        origin.name(),
                        completed.bridgeTransferId(),
                        completed.details(),
                        e.getMessage(),
                        clock.instant()
                ));
            }
        }

        // Locked: confirmation of the lock call the tracker dispatched.
        log.info("event=bridge_service.counterparty_locked origin={} transferId={}", origin, event.bridgeTransferId());
        return Optional.of(observed(origin, event));
    }

    private <S extends ChainAddress, D extends ChainAddress> BridgeWarning alreadyPresent(
            EventOrigin origin,
            ActiveSwapTracker<S, D> tracker,
            BridgeTransferDetails<S> details
    ) {
        BridgeTransferId id = details.bridgeTransferId();
        boolean consistent = tracker.find(id)
                .map(existing -> existing.details().equals(details))
                .orElse(true);
        if (consistent) {
            log.warn("event=bridge_service.initiated.already_present origin={} transferId={}", origin, id);
        } else {
            log.error("event=bridge_service.initiated.conflicting_replay origin={} transferId={}", origin, id);
        }
        return new BridgeWarning(
                WarningKind.ALREADY_PRESENT,
                consistent ? WarningSeverity.WARNING : WarningSeverity.CRITICAL,
                origin.name(),
                id,
                details,
                consistent
                        ? "bridge transfer already present; monitoring should deliver each initiation once"
                        : "bridge transfer already present with different details; possible reorg or inconsistent replay",
                clock.instant()
        );
    }

    private BridgeWarning callFailure(WarningKind kind, SwapDirection direction, ActiveSwapError error) {
        // A failed claim has already left the registry; only an operator holding the secret can finish it.
        WarningSeverity severity = kind == WarningKind.COMPLETING_FAILED ? WarningSeverity.CRITICAL : WarningSeverity.WARNING;
        return new BridgeWarning(
                kind,
                severity,
                direction.label(),
                error.bridgeTransferId(),
                error,
                error.operation() + " failed after " + error.attempts() + " attempt(s): " + error.reason(),
                clock.instant()
        );
    }

    private ContractEventObserved observed(EventOrigin origin, ContractEvent<?> event) {
        return new ContractEventObserved(origin, event, clock.instant());
    }
}
