package lab.bridge.chain;

// Names used for chain event sources, warning sources and sim routes.
public final class ChainNames {

    public static final String CHAIN_ONE = "chain-one";
    public static final String CHAIN_TWO = "chain-two";

    private ChainNames() {
    }
}
