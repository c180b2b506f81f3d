package lab.bridge.chain;

public record ContractCallResult(
        String txHash,
        boolean accepted
) {}
