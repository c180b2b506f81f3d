package lab.bridge.sim.fakechain;

import lab.bridge.chain.ChainNames;
import lab.bridge.domain.transfer.EvmAddress;
import lab.bridge.domain.transfer.MoveAddress;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FakeChainConfig {

    @Bean
    @ConditionalOnProperty(prefix = "bridge.chain-one", name = "mode", havingValue = "mock", matchIfMissing = true)
    public FakeChain<EvmAddress> chainOne() {
        return new FakeChain<>(ChainNames.CHAIN_ONE);
    }

    // No RPC adapter exists for the Move side yet; it is always simulated.
    @Bean
    public FakeChain<MoveAddress> chainTwo() {
        return new FakeChain<>(ChainNames.CHAIN_TWO);
    }
}
