package lab.bridge.chain;

import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.ChainAddress;
import lab.bridge.domain.transfer.HashLockPreImage;
import lab.bridge.domain.transfer.LockDetails;

import java.util.concurrent.CompletableFuture;

/**
 * Client of the counterparty contract on one chain.
 */
public interface BridgeContractCounterparty<A extends ChainAddress> {

    CompletableFuture<ContractCallResult> lockBridgeTransfer(LockDetails<A> details);

    CompletableFuture<ContractCallResult> completeBridgeTransfer(BridgeTransferId bridgeTransferId, HashLockPreImage preImage);

    // Returns locked assets to the relayer once the initiator side has been refunded.
    CompletableFuture<ContractCallResult> abortBridgeTransfer(BridgeTransferId bridgeTransferId);
}
