package lab.bridge.relay;

import lab.bridge.chain.BlockchainService;
import lab.bridge.chain.EvmMoveChainPair;
import lab.bridge.domain.transfer.EvmAddress;
import lab.bridge.domain.transfer.MoveAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class BridgeRelayConfig {

    @Bean
    public Clock bridgeClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy trackerRetryPolicy(
            @Value("${bridge.tracker.max-attempts:3}") int maxAttempts,
            @Value("${bridge.tracker.retry-backoff-ms:0}") long retryBackoffMs
    ) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(retryBackoffMs));
    }

    // Chain one is EVM (mock or rpc), chain two is Move.
    @Bean
    public BridgeService<EvmAddress, MoveAddress> bridgeService(
            BlockchainService<EvmAddress> chainOne,
            BlockchainService<MoveAddress> chainTwo,
            EvmMoveChainPair chainPair,
            RetryPolicy trackerRetryPolicy,
            @Value("${bridge.relay.reverse-direction-enabled:false}") boolean reverseDirectionEnabled,
            Clock bridgeClock
    ) {
        log.info("event=bridge_relay.config chainOne={} chainTwo={} maxAttempts={} retryBackoffMs={} reverseDirectionEnabled={}",
                chainOne.name(), chainTwo.name(), trackerRetryPolicy.maxAttempts(), trackerRetryPolicy.backoff().toMillis(),
                reverseDirectionEnabled);
        return new BridgeService<>(chainOne, chainTwo, chainPair, trackerRetryPolicy, reverseDirectionEnabled, bridgeClock);
    }
}
