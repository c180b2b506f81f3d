package lab.bridge.domain.transfer;

/**
 * Address in the native representation of one chain.
 */
public interface ChainAddress {

    byte[] toBytes();

    String toHex();
}
