package lab.bridge.domain.intervention;

public enum InterventionStatus {
    OPEN,
    RESOLVED
}
