package lab.bridge.relay;

import lab.bridge.domain.transfer.BridgeTransferId;
import lombok.Getter;

// The tracker of a direction has no entry for the requested transfer id.
@Getter
public class NonExistingSwapException extends RuntimeException {

    private final SwapDirection direction;
    private final BridgeTransferId bridgeTransferId;

    public NonExistingSwapException(SwapDirection direction, BridgeTransferId bridgeTransferId) {
        super("no active swap " + bridgeTransferId + " in direction " + direction.label());
        this.direction = direction;
        this.bridgeTransferId = bridgeTransferId;
    }
}
