package lab.bridge.relay;

/**
 * Consumer of the unified relay output. Called from the relay thread; implementations must not block
 * for long.
 */
public interface BridgeEventSink {

    void accept(BridgeEvent event);
}
