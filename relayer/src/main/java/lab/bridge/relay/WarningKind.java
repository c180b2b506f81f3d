package lab.bridge.relay;

public enum WarningKind {
    ALREADY_PRESENT,
    CANNOT_COMPLETE_UNEXISTING_SWAP,
    LOCKING_FAILED,
    COMPLETING_FAILED,
    ABORTING_FAILED,
    SOURCE_TERMINATED
}
