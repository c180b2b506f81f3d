package lab.bridge.chain;

import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.ChainAddress;
import lab.bridge.domain.transfer.CounterpartyCompletedDetails;
import lab.bridge.domain.transfer.LockDetails;

public interface BridgeContractCounterpartyEvent<A extends ChainAddress> extends ContractEvent<A> {

    record Locked<A extends ChainAddress>(LockDetails<A> details) implements BridgeContractCounterpartyEvent<A> {
        @Override
        public BridgeTransferId bridgeTransferId() {
            return details.bridgeTransferId();
        }
    }

    record Completed<A extends ChainAddress>(CounterpartyCompletedDetails details) implements BridgeContractCounterpartyEvent<A> {
        @Override
        public BridgeTransferId bridgeTransferId() {
            return details.bridgeTransferId();
        }
    }
}
