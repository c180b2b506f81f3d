package lab.bridge.relay;

import lab.bridge.domain.transfer.BridgeTransferDetails;
import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.ChainAddress;

import java.time.Instant;

/**
 * Registry entry for a swap being relayed in one direction. Status changes produce a new instance.
 */
public record ActiveSwap<A extends ChainAddress>(
        BridgeTransferId bridgeTransferId,
        BridgeTransferDetails<A> details,
        ActiveSwapStatus status,
        Instant registeredAt,
        Instant updatedAt
) {
    public static <A extends ChainAddress> ActiveSwap<A> locking(BridgeTransferDetails<A> details, Instant now) {
        return new ActiveSwap<>(details.bridgeTransferId(), details, ActiveSwapStatus.LOCKING, now, now);
    }

    public ActiveSwap<A> transitionTo(ActiveSwapStatus next, Instant now) {
        return new ActiveSwap<>(bridgeTransferId, details, next, registeredAt, now);
    }
}
