package lab.bridge.chain;

import lab.bridge.domain.transfer.BridgeTransferId;
import lab.bridge.domain.transfer.ChainAddress;

/**
 * Event emitted by one of the bridge contracts of a chain: either a {@link BridgeContractInitiatorEvent}
 * or a {@link BridgeContractCounterpartyEvent}.
 */
public interface ContractEvent<A extends ChainAddress> {

    BridgeTransferId bridgeTransferId();
}
