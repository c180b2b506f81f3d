package lab.bridge.chain;

import lab.bridge.domain.transfer.ChainAddress;
import lab.bridge.stream.EventSource;

/**
 * Everything the relayer needs from one chain: its contract event feed and clients for both bridge
 * contracts. How events are discovered (polling or subscription) is up to the implementation.
 */
public interface BlockchainService<A extends ChainAddress> {

    String name();

    EventSource<ContractEvent<A>> events();

    BridgeContractInitiator<A> initiatorContract();

    BridgeContractCounterparty<A> counterpartyContract();
}
