package lab.bridge.relay;

import lab.bridge.chain.AddressConversionException;
import lab.bridge.chain.AddressConverter;
import lab.bridge.chain.BridgeContractCounterparty;
import lab.bridge.chain.BridgeContractInitiator;
import lab.bridge.chain.ContractCallException;
import lab.bridge.chain.ContractCallResult;
import lab.bridge.domain.transfer.BridgeTransferDetails;
import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.ChainAddress;
import lab.bridge.domain.transfer.CounterpartyCompletedDetails;
import lab.bridge.domain.transfer.LockDetails;
import lab.bridge.stream.EventSource;
import lab.bridge.stream.MailboxEventSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of the swaps relayed in one direction, plus the contract calls that drive them.
 *
 * <p>A swap initiated on the source chain (address type {@code S}) is mirrored by a lock on the
 * counterparty contract of the destination chain ({@code D}). Once the recipient claims on the
 * destination chain, the revealed secret is used to claim the initiator-side funds on the source chain.
 *
 * <p>Calls are fire-and-forget for the caller: their outcomes arrive later on {@link #events()}. Failed
 * calls are retried according to the {@link RetryPolicy}; only the final failure is published.
 * Registry mutations only happen through {@link #startBridgeTransfer}, {@link #completeBridgeTransfer}
 * and {@link #abortBridgeTransfer}; call outcomes only refine the status of entries still present.
 */
@Slf4j
public class ActiveSwapTracker<S extends ChainAddress, D extends ChainAddress> {

    private final SwapDirection direction;
    private final BridgeContractInitiator<S> initiatorContract;
    private final BridgeContractCounterparty<D> counterpartyContract;
    private final AddressConverter<S, D> converter;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    private final Map<BridgeTransferId, ActiveSwap<S>> swaps = new ConcurrentHashMap<>();
    private final MailboxEventSource<ActiveSwapEvent> progress;

    public ActiveSwapTracker(
            SwapDirection direction,
            BridgeContractInitiator<S> initiatorContract,
            BridgeContractCounterparty<D> counterpartyContract,
            AddressConverter<S, D> converter,
            RetryPolicy retryPolicy,
            Clock clock
    ) {
        this.direction = direction;
        this.initiatorContract = initiatorContract;
        this.counterpartyContract = counterpartyContract;
        this.converter = converter;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.progress = new MailboxEventSource<>("active-swaps-" + direction.label());
    }

    public SwapDirection direction() {
        return direction;
    }

    public EventSource<ActiveSwapEvent> events() {
        return progress;
    }

    public boolean alreadyExecuting(BridgeTransferId bridgeTransferId) {
        return swaps.containsKey(bridgeTransferId);
    }

    public Optional<ActiveSwap<S>> find(BridgeTransferId bridgeTransferId) {
        return Optional.ofNullable(swaps.get(bridgeTransferId));
    }

    public int size() {
        return swaps.size();
    }

    public List<ActiveSwap<S>> snapshot() {
        return swaps.values().stream()
                .sorted(Comparator.comparing(ActiveSwap::registeredAt))
                .toList();
    }

    /**
     * Registers the swap and dispatches the lock call on the destination chain.
     *
     * @throws IllegalStateException if the transfer id is already tracked in this direction
     */
    public void startBridgeTransfer(BridgeTransferDetails<S> details) {
        BridgeTransferId id = details.bridgeTransferId();
        if (swaps.putIfAbsent(id, ActiveSwap.locking(details, clock.instant())) != null) {
            throw new IllegalStateException("swap " + id + " is already tracked in direction " + direction.label());
        }
        log.info("event=active_swaps.start direction={} transferId={} amount={}", direction.label(), id, details.amount().value());

        LockDetails<D> lockDetails;
        try {
            lockDetails = new LockDetails<>(
                    id,
                    converter.toInitiator(details.initiatorAddress()),
                    converter.toRecipient(details.recipientAddress()),
                    details.hashLock(),
                    details.timeLock(),
                    details.amount()
            );
        } catch (AddressConversionException e) {
            // Not retryable: the same bytes would fail again, and no lock will ever exist to track.
            swaps.remove(id);
            log.warn("event=active_swaps.lock.unconvertible direction={} transferId={} reason={}", direction.label(), id, e.getMessage());
            progress.publish(new ActiveSwapEvent.AssetsLockingError(new ActiveSwapError(id, "lock", 0, e.getMessage())));
            return;
        }

        callWithRetry("lock", id, () -> counterpartyContract.lockBridgeTransfer(lockDetails))
                .whenComplete((result, error) -> {
                    if (error == null) {
                        swaps.computeIfPresent(id, (key, swap) -> swap.status() == ActiveSwapStatus.LOCKING
                                ? swap.transitionTo(ActiveSwapStatus.LOCKED, clock.instant())
                                : swap);
                        progress.publish(new ActiveSwapEvent.AssetsLocked(id, result.txHash()));
                    } else {
                        progress.publish(new ActiveSwapEvent.AssetsLockingError(toError(id, "lock", error)));
                    }
                });
    }

    /**
     * Dispatches the initiator-side claim with the secret revealed on the destination chain, then drops
     * the entry. Confirmation of the claim is observed later as a contract event of the source chain.
     *
     * @throws NonExistingSwapException if the id is not tracked; nothing is called in that case
     */
    public void completeBridgeTransfer(CounterpartyCompletedDetails details) {
        BridgeTransferId id = details.bridgeTransferId();
        ActiveSwap<S> swap = swaps.computeIfPresent(id, (key, current) -> current.transitionTo(ActiveSwapStatus.COMPLETING, clock.instant()));
        if (swap == null) {
            throw new NonExistingSwapException(direction, id);
        }
        log.info("event=active_swaps.complete direction={} transferId={} status={}", direction.label(), id, swap.status());

        callWithRetry("complete", id, () -> initiatorContract.completeBridgeTransfer(id, details.secret()))
                .whenComplete((result, error) -> {
                    if (error == null) {
                        progress.publish(new ActiveSwapEvent.AssetsCompleted(id, result.txHash()));
                    } else {
                        progress.publish(new ActiveSwapEvent.AssetsCompletingError(toError(id, "complete", error)));
                    }
                });

        swaps.remove(id);
        log.debug("event=active_swaps.removed direction={} transferId={} status={}", direction.label(), id, ActiveSwapStatus.COMPLETED_PENDING_REMOVAL);
    }

    /**
     * Releases the destination-chain lock of a swap whose initiator was refunded, and drops the entry.
     *
     * @throws NonExistingSwapException if the id is not tracked
     */
    public void abortBridgeTransfer(BridgeTransferId id) {
        ActiveSwap<S> removed = swaps.remove(id);
        if (removed == null) {
            throw new NonExistingSwapException(direction, id);
        }
        log.info("event=active_swaps.abort direction={} transferId={} previousStatus={}", direction.label(), id, removed.status());

        callWithRetry("abort", id, () -> counterpartyContract.abortBridgeTransfer(id))
                .whenComplete((result, error) -> {
                    if (error == null) {
                        progress.publish(new ActiveSwapEvent.AssetsAborted(id, result.txHash()));
                    } else {
                        progress.publish(new ActiveSwapEvent.AssetsAbortingError(toError(id, "abort", error)));
                    }
                });
    }

    private CompletableFuture<ContractCallResult> callWithRetry(
            String operation,
            BridgeTransferId id,
            Supplier<CompletableFuture<ContractCallResult>> call
    ) {
        CompletableFuture<ContractCallResult> outcome = new CompletableFuture<>();
        attempt(operation, id, call, 1, outcome);
        return outcome;
    }

    private void attempt(
            String operation,
            BridgeTransferId id,
            Supplier<CompletableFuture<ContractCallResult>> call,
            int attemptNo,
            CompletableFuture<ContractCallResult> outcome
    ) {
        CompletableFuture<ContractCallResult> pending;
        try {
            pending = call.get();
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        pending.thenApply(ActiveSwapTracker::requireAccepted).whenComplete((result, error) -> {
            if (error == null) {
                log.debug("event=active_swaps.call.accepted direction={} operation={} transferId={} attemptNo={} txHash={}",
                        direction.label(), operation, id, attemptNo, result.txHash());
                outcome.complete(result);
                return;
            }
            Throwable cause = unwrap(error);
            if (attemptNo >= retryPolicy.maxAttempts()) {
                log.warn("event=active_swaps.call.exhausted direction={} operation={} transferId={} attempts={} reason={}",
                        direction.label(), operation, id, attemptNo, cause.getMessage());
                outcome.completeExceptionally(new AttemptsExhaustedException(attemptNo, cause));
                return;
            }
            log.warn("event=active_swaps.call.retry direction={} operation={} transferId={} attemptNo={} reason={}",
                    direction.label(), operation, id, attemptNo, cause.getMessage());
            retryPolicy.nextAttemptExecutor().execute(() -> attempt(operation, id, call, attemptNo + 1, outcome));
        });
    }

    private static ContractCallResult requireAccepted(ContractCallResult result) {
        if (result == null || !result.accepted()) {
            throw new ContractCallException("call rejected" + (result == null ? "" : " txHash=" + result.txHash()));
        }
        return result;
    }

    private static ActiveSwapError toError(BridgeTransferId id, String operation, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof AttemptsExhaustedException exhausted) {
            return new ActiveSwapError(id, operation, exhausted.attempts, exhausted.getCause().getMessage());
        }
        return new ActiveSwapError(id, operation, 1, cause.getMessage());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class AttemptsExhaustedException extends RuntimeException {

        private final int attempts;

        private AttemptsExhaustedException(int attempts, Throwable cause) {
            super("gave up after " + attempts + " attempts", cause);
            this.attempts = attempts;
        }
    }
}
