package lab.bridge.relay;

public enum ActiveSwapStatus {
    LOCKING,                    // lock call dispatched to the counterparty chain
    LOCKED,                     // lock call accepted
    COMPLETING,                 // counterparty claim observed, initiator claim being dispatched
    COMPLETED_PENDING_REMOVAL
}
