package lab.bridge.chain;

import lab.bridge.domain.transfer.BridgeTransferDetails;
import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.ChainAddress;
import lab.bridge.domain.transfer.HashLockPreImage;

public interface BridgeContractInitiatorEvent<A extends ChainAddress> extends ContractEvent<A> {

    record Initiated<A extends ChainAddress>(BridgeTransferDetails<A> details) implements BridgeContractInitiatorEvent<A> {
        @Override
        public BridgeTransferId bridgeTransferId() {
            return details.bridgeTransferId();
        }
    }

    // The relayer claimed the initiator-side funds with the secret.
    record Completed<A extends ChainAddress>(BridgeTransferId bridgeTransferId, HashLockPreImage secret)
            implements BridgeContractInitiatorEvent<A> {}

    record Refunded<A extends ChainAddress>(BridgeTransferId bridgeTransferId) implements BridgeContractInitiatorEvent<A> {}
}
