package lab.bridge.chain;

import lab.bridge.domain.transfer.ChainAddress;

// Conversions in both relay directions for one concrete pair of chains.
public interface BridgeChainPair<A1 extends ChainAddress, A2 extends ChainAddress> {

    AddressConverter<A1, A2> oneToTwo();

    AddressConverter<A2, A1> twoToOne();
}
