package lab.bridge.chain;

import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.ChainAddress;
import lab.bridge.domain.transfer.HashLockPreImage;

import java.util.concurrent.CompletableFuture;

/**
 * Client of the initiator contract on one chain. Calls are asynchronous; the returned future fails with
 * {@link ContractCallException} when the call could not be submitted.
 */
public interface BridgeContractInitiator<A extends ChainAddress> {

    // Claims the initiator-side funds for the relayer with the secret revealed on the other chain.
    CompletableFuture<ContractCallResult> completeBridgeTransfer(BridgeTransferId bridgeTransferId, HashLockPreImage preImage);

    CompletableFuture<ContractCallResult> refundBridgeTransfer(BridgeTransferId bridgeTransferId);
}
