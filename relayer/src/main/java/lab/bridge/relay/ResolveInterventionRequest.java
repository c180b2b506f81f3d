package lab.bridge.relay;

public record ResolveInterventionRequest(
        String resolvedBy,
        String note
) {}
