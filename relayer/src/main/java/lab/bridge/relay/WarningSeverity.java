package lab.bridge.relay;

public enum WarningSeverity {
    WARNING,
    // Funds may be stuck until an operator acts.
    CRITICAL
}
