package lab.bridge.relay;

import lab.bridge.domain.transfer.BridgeTransferId;

/**
 * Terminal failure of a tracker-dispatched contract call, after retries.
 *
 * @param attempts number of calls made; 0 when the call could not even be built
 */
public record ActiveSwapError(
        BridgeTransferId bridgeTransferId,
        String operation,
        int attempts,
        String reason
) {}
