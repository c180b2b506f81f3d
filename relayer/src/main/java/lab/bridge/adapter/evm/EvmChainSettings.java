package lab.bridge.adapter.evm;

import java.math.BigInteger;

/**
 * @param startBlock first block scanned for bridge logs; null starts at the current head
 */
public record EvmChainSettings(
        long chainId,
        String initiatorContract,
        String counterpartyContract,
        long pollIntervalMs,
        int maxBlockRange,
        BigInteger gasLimit,
        BigInteger maxPriorityFeePerGas,
        BigInteger maxFeePerGas,
        BigInteger startBlock
) {
    public EvmChainSettings {
        if (pollIntervalMs < 1) {
            throw new IllegalArgumentException("bridge.evm.poll-interval-ms must be positive");
        }
        if (maxBlockRange < 1) {
            throw new IllegalArgumentException("bridge.evm.max-block-range must be positive");
        }
    }
}
