package lab.bridge.relay;

import lab.bridge.chain.BridgeContractCounterpartyEvent;
import lab.bridge.chain.BridgeContractInitiatorEvent;
import lab.bridge.chain.EvmMoveChainPair;
import lab.bridge.domain.transfer.Amount;
import lab.bridge.domain.transfer.BridgeTransferDetails;
import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.CounterpartyCompletedDetails;
import lab.bridge.domain.transfer.EvmAddress;
import lab.bridge.domain.transfer.MoveAddress;
import lab.bridge.domain.transfer.RecipientAddress;
import lab.bridge.sim.fakechain.FakeChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static lab.bridge.relay.SwapFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class BridgeServiceTest {

    FakeChain<EvmAddress> chainOne;
    FakeChain<MoveAddress> chainTwo;
    BridgeService<EvmAddress, MoveAddress> bridgeService;

    @BeforeEach
    void setUp() {
        chainOne = new FakeChain<>("chain-one");
        chainTwo = new FakeChain<>("chain-two");
        bridgeService = newService(false);
    }

    @Test
    void happyPath_locksOnChainTwoThenClaimsOnChainOneWithRevealedSecret() {
        BridgeTransferId id = initiateOnChainOne();

        List<BridgeEvent> afterInitiate = drain();
        assertThat(afterInitiate).hasSize(3);
        assertObserved(afterInitiate.get(0), EventOrigin.B1I, BridgeContractInitiatorEvent.Initiated.class);
        // Tracker progress is visited before chain two's feed.
        assertProgress(afterInitiate.get(1), ActiveSwapEvent.AssetsLocked.class);
        assertObserved(afterInitiate.get(2), EventOrigin.B2C, BridgeContractCounterpartyEvent.Locked.class);
        assertThat(chainTwo.lockState(id)).contains(FakeChain.LockState.LOCKED);
        assertThat(chainTwo.lock(id)).get().extracting(lock -> lock.recipientAddress()).isEqualTo(MOVE_BOB);
        assertThat(bridgeService.activeSwapsOneToTwo().find(id)).get()
                .extracting(ActiveSwap::status).isEqualTo(ActiveSwapStatus.LOCKED);

        chainTwo.claim(id, SECRET);

        List<BridgeEvent> afterClaim = drain();
        assertThat(afterClaim).hasSize(3);
        assertObserved(afterClaim.get(0), EventOrigin.B2C, BridgeContractCounterpartyEvent.Completed.class);
        assertProgress(afterClaim.get(1), ActiveSwapEvent.AssetsCompleted.class);
        assertObserved(afterClaim.get(2), EventOrigin.B1I, BridgeContractInitiatorEvent.Completed.class);

        assertThat(chainOne.initiatorState(id)).contains(FakeChain.InitiatorState.COMPLETED);
        assertThat(chainOne.claimedSecret(id)).contains(SECRET);
        assertThat(bridgeService.activeSwapsOneToTwo().size()).isZero();
        assertThat(bridgeService.poll()).isEmpty();
    }

    @Test
    void replayedInitiation_warnsOnceAndDoesNotLockAgain() {
        BridgeTransferId id = initiateOnChainOne();
        drain();

        chainOne.replayInitiated(id);

        List<BridgeEvent> events = drain();
        assertThat(events).singleElement().isInstanceOfSatisfying(BridgeWarning.class, warning -> {
            assertThat(warning.kind()).isEqualTo(WarningKind.ALREADY_PRESENT);
            assertThat(warning.severity()).isEqualTo(WarningSeverity.WARNING);
            assertThat(warning.source()).isEqualTo("B1I");
            assertThat(warning.bridgeTransferId()).isEqualTo(id);
        });
        assertThat(chainTwo.callCount("counterparty.lock")).isEqualTo(1);
        assertThat(bridgeService.activeSwapsOneToTwo().size()).isEqualTo(1);
    }

    @Test
    void replayWithDifferentDetails_isCritical() {
        BridgeTransferId id = initiateOnChainOne();
        drain();
        BridgeTransferDetails<EvmAddress> tampered = new BridgeTransferDetails<>(
                id, EVM_ALICE, RecipientAddress.of(MOVE_BOB.toBytes()), HASH_LOCK, TIME_LOCK, Amount.of(999_999));

        chainOne.emit(new BridgeContractInitiatorEvent.Initiated<>(tampered));

        assertThat(drain()).singleElement().isInstanceOfSatisfying(BridgeWarning.class, warning -> {
            assertThat(warning.kind()).isEqualTo(WarningKind.ALREADY_PRESENT);
            assertThat(warning.isCritical()).isTrue();
        });
        assertThat(bridgeService.activeSwapsOneToTwo().find(id)).get()
                .extracting(swap -> swap.details().amount()).isEqualTo(AMOUNT);
    }

    @Test
    void counterpartyCompletionForUnknownSwap_raisesCriticalWarningWithTheSecret() {
        BridgeTransferId unknown = transferId(0x42);

        chainTwo.emit(new BridgeContractCounterpartyEvent.Completed<>(new CounterpartyCompletedDetails(unknown, SECRET)));

        assertThat(drain()).singleElement().isInstanceOfSatisfying(BridgeWarning.class, warning -> {
            assertThat(warning.kind()).isEqualTo(WarningKind.CANNOT_COMPLETE_UNEXISTING_SWAP);
            assertThat(warning.severity()).isEqualTo(WarningSeverity.CRITICAL);
            assertThat(warning.source()).isEqualTo("B2C");
            assertThat(warning.detail()).isEqualTo(new CounterpartyCompletedDetails(unknown, SECRET));
        });
        assertThat(chainOne.callCount("initiator.complete")).isZero();
    }

    @Test
    void refundOnChainOne_abortsTheChainTwoLock() {
        BridgeTransferId id = initiateOnChainOne();
        drain();

        chainOne.refund(id);

        List<BridgeEvent> events = drain();
        assertThat(events).hasSize(2);
        assertObserved(events.get(0), EventOrigin.B1I, BridgeContractInitiatorEvent.Refunded.class);
        assertProgress(events.get(1), ActiveSwapEvent.AssetsAborted.class);
        assertThat(chainTwo.lockState(id)).contains(FakeChain.LockState.ABORTED);
        assertThat(bridgeService.activeSwapsOneToTwo().alreadyExecuting(id)).isFalse();
    }

    @Test
    void lockFailingOnEveryAttempt_isReportedAsWarning() {
        chainTwo.setNextOutcome(FakeChain.NextOutcome.FAIL_SYSTEM, 3);
        BridgeTransferId id = initiateOnChainOne();

        List<BridgeEvent> events = drain();

        assertThat(events).hasSize(2);
        assertObserved(events.get(0), EventOrigin.B1I, BridgeContractInitiatorEvent.Initiated.class);
        assertThat(events.get(1)).isInstanceOfSatisfying(BridgeWarning.class, warning -> {
            assertThat(warning.kind()).isEqualTo(WarningKind.LOCKING_FAILED);
            assertThat(warning.severity()).isEqualTo(WarningSeverity.WARNING);
            assertThat(warning.source()).isEqualTo("B1->B2");
            assertThat(warning.bridgeTransferId()).isEqualTo(id);
        });
        assertThat(chainTwo.callCount("counterparty.lock")).isEqualTo(3);
        assertThat(chainTwo.lockState(id)).isEmpty();
    }

    @Test
    void claimFailingOnEveryAttempt_isCriticalAndTheSwapIsNoLongerTracked() {
        BridgeTransferId id = initiateOnChainOne();
        drain();
        chainOne.setNextOutcome(FakeChain.NextOutcome.FAIL_SYSTEM, 3);

        chainTwo.claim(id, SECRET);

        List<BridgeEvent> events = drain();
        assertThat(events).hasSize(2);
        assertObserved(events.get(0), EventOrigin.B2C, BridgeContractCounterpartyEvent.Completed.class);
        assertThat(events.get(1)).isInstanceOfSatisfying(BridgeWarning.class, warning -> {
            assertThat(warning.kind()).isEqualTo(WarningKind.COMPLETING_FAILED);
            assertThat(warning.severity()).isEqualTo(WarningSeverity.CRITICAL);
            assertThat(warning.source()).isEqualTo("B1->B2");
            assertThat(warning.bridgeTransferId()).isEqualTo(id);
        });
        assertThat(chainOne.callCount("initiator.complete")).isEqualTo(3);
        assertThat(chainOne.initiatorState(id)).contains(FakeChain.InitiatorState.INITIATED);
        assertThat(bridgeService.activeSwapsOneToTwo().size()).isZero();
    }

    @Test
    void unconvertibleRecipient_isNotTrackedSoALaterRefundAbortsNothing() {
        BridgeTransferId id = chainOne.initiate(EVM_ALICE, RecipientAddress.of(filled(33, 1)), HASH_LOCK, TIME_LOCK, AMOUNT);

        List<BridgeEvent> afterInitiate = drain();
        assertThat(afterInitiate).hasSize(2);
        assertThat(afterInitiate.get(1)).isInstanceOfSatisfying(BridgeWarning.class,
                warning -> assertThat(warning.kind()).isEqualTo(WarningKind.LOCKING_FAILED));
        assertThat(bridgeService.activeSwapsOneToTwo().alreadyExecuting(id)).isFalse();

        chainOne.refund(id);

        assertThat(drain()).singleElement()
                .satisfies(event -> assertObserved(event, EventOrigin.B1I, BridgeContractInitiatorEvent.Refunded.class));
        assertThat(chainTwo.callCount("counterparty.abort")).isZero();
    }

    @Test
    void terminatedChainFeed_isReportedOnceAndOtherSourcesKeepFlowing() {
        chainOne.failEventStream("undecodable log");

        assertThat(bridgeService.poll()).get().isInstanceOfSatisfying(BridgeWarning.class, warning -> {
            assertThat(warning.kind()).isEqualTo(WarningKind.SOURCE_TERMINATED);
            assertThat(warning.isCritical()).isTrue();
            assertThat(warning.source()).isEqualTo("chain-one");
        });
        assertThat(bridgeService.poll()).isEmpty();

        chainTwo.emit(new BridgeContractCounterpartyEvent.Completed<>(new CounterpartyCompletedDetails(transferId(0x43), SECRET)));
        assertThat(drain()).singleElement().isInstanceOfSatisfying(BridgeWarning.class,
                warning -> assertThat(warning.kind()).isEqualTo(WarningKind.CANNOT_COMPLETE_UNEXISTING_SWAP));
    }

    @Test
    void reverseDirectionDisabled_chainTwoInitiationIsOnlyTraced() {
        chainTwo.initiate(MOVE_ALICE, RecipientAddress.of(EVM_BOB.toBytes()), HASH_LOCK, TIME_LOCK, AMOUNT);

        assertThat(drain()).isEmpty();
        assertThat(chainOne.callCount("counterparty.lock")).isZero();
        assertThat(bridgeService.activeSwapsTwoToOne().size()).isZero();
    }

    @Test
    void reverseDirectionEnabled_mirrorsTheForwardFlow() {
        bridgeService = newService(true);
        BridgeTransferId id = chainTwo.initiate(MOVE_ALICE, RecipientAddress.of(EVM_BOB.toBytes()), HASH_LOCK, TIME_LOCK, AMOUNT);

        List<BridgeEvent> afterInitiate = drain();
        assertObserved(afterInitiate.get(0), EventOrigin.B2I, BridgeContractInitiatorEvent.Initiated.class);
        assertThat(chainOne.lock(id)).get().extracting(lock -> lock.recipientAddress()).isEqualTo(EVM_BOB);
        assertThat(afterInitiate).anySatisfy(event -> assertObserved(event, EventOrigin.B1C, BridgeContractCounterpartyEvent.Locked.class));

        chainOne.claim(id, SECRET);

        List<BridgeEvent> afterClaim = drain();
        assertObserved(afterClaim.get(0), EventOrigin.B1C, BridgeContractCounterpartyEvent.Completed.class);
        assertThat(afterClaim).anySatisfy(event -> assertObserved(event, EventOrigin.B2I, BridgeContractInitiatorEvent.Completed.class));
        assertThat(chainTwo.initiatorState(id)).contains(FakeChain.InitiatorState.COMPLETED);
        assertThat(bridgeService.activeSwapsTwoToOne().size()).isZero();
    }

    @Test
    void onReady_firesWhenAnySourcePublishes() {
        List<String> signals = new ArrayList<>();
        bridgeService.onReady(() -> signals.add("ready"));

        initiateOnChainOne();

        assertThat(signals).isNotEmpty();
    }

    private BridgeService<EvmAddress, MoveAddress> newService(boolean reverseDirectionEnabled) {
        return new BridgeService<>(chainOne, chainTwo, new EvmMoveChainPair(), RetryPolicy.immediate(3), reverseDirectionEnabled, CLOCK);
    }

    private BridgeTransferId initiateOnChainOne() {
        return chainOne.initiate(EVM_ALICE, RecipientAddress.of(MOVE_BOB.toBytes()), HASH_LOCK, TIME_LOCK, AMOUNT);
    }

    private List<BridgeEvent> drain() {
        List<BridgeEvent> events = new ArrayList<>();
        Optional<BridgeEvent> next = bridgeService.poll();
        while (next.isPresent()) {
            events.add(next.get());
            next = bridgeService.poll();
        }
        return events;
    }

    private static void assertObserved(BridgeEvent event, EventOrigin origin, Class<?> contractEventType) {
        assertThat(event).isInstanceOfSatisfying(ContractEventObserved.class, observed -> {
            assertThat(observed.origin()).isEqualTo(origin);
            assertThat(observed.event()).isInstanceOf(contractEventType);
        });
    }

    private static void assertProgress(BridgeEvent event, Class<? extends ActiveSwapEvent> outcome) {
        assertThat(event).isInstanceOfSatisfying(SwapProgressReported.class, progress -> {
            assertThat(progress.direction()).isEqualTo(SwapDirection.B1_TO_B2);
            assertThat(progress.progress()).isInstanceOf(outcome);
        });
    }
}
