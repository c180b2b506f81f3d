package lab.bridge.domain.transfer;

import java.util.Objects;

/**
 * Lock placed on the counterparty chain, mirroring an initiation on the other chain.
 */
public record LockDetails<A extends ChainAddress>(
        BridgeTransferId bridgeTransferId,
        InitiatorAddress initiatorAddress,
        A recipientAddress,
        HashLock hashLock,
        TimeLock timeLock,
        Amount amount
) {
    public LockDetails {
        Objects.requireNonNull(bridgeTransferId, "bridgeTransferId");
        Objects.requireNonNull(initiatorAddress, "initiatorAddress");
        Objects.requireNonNull(recipientAddress, "recipientAddress");
        Objects.requireNonNull(hashLock, "hashLock");
        Objects.requireNonNull(timeLock, "timeLock");
        Objects.requireNonNull(amount, "amount");
    }
}
