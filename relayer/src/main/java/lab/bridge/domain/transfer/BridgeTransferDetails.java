package lab.bridge.domain.transfer;

import java.util.Objects;

/**
 * Swap as initiated on the source chain. Immutable; carries everything the relayer needs to replay the
 * lock call on the destination chain.
 */
public record BridgeTransferDetails<A extends ChainAddress>(
        BridgeTransferId bridgeTransferId,
        A initiatorAddress,
        RecipientAddress recipientAddress,
        HashLock hashLock,
        TimeLock timeLock,
        Amount amount
) {
    public BridgeTransferDetails {
        Objects.requireNonNull(bridgeTransferId, "bridgeTransferId");
        Objects.requireNonNull(initiatorAddress, "initiatorAddress");
        Objects.requireNonNull(recipientAddress, "recipientAddress");
        Objects.requireNonNull(hashLock, "hashLock");
        Objects.requireNonNull(timeLock, "timeLock");
        Objects.requireNonNull(amount, "amount");
    }
}
