package lab.bridge.relay;

// Chain and contract role a contract event was observed on.
public enum EventOrigin {
    B1I,
    B1C,
    B2I,
    B2C
}
