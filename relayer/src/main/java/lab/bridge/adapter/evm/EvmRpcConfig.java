package lab.bridge.adapter.evm;

import java.math.BigInteger;
import java.net.InetSocketAddress;
import java.net.Proxy;

import lab.bridge.chain.ChainNames;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.Route;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Configuration
@ConditionalOnProperty(prefix = "bridge.chain-one", name = "mode", havingValue = "rpc")
public class EvmRpcConfig {

    @Bean(destroyMethod = "shutdown")
    @DependsOn("rpcModeStartupGuard")
    public Web3j web3j(
            @Value("${bridge.evm.rpc-url}") String rpcUrl,
            @Value("${bridge.evm.proxy.enabled:false}") boolean proxyEnabled,
            @Value("${bridge.evm.proxy.host:}") String proxyHost,
            @Value("${bridge.evm.proxy.port:8080}") int proxyPort,
            @Value("${bridge.evm.proxy.username:}") String proxyUsername,
            @Value("${bridge.evm.proxy.password:}") String proxyPassword) {
        if (!proxyEnabled) {
            return Web3j.build(new HttpService(rpcUrl));
        }
        if (proxyHost == null || proxyHost.isBlank()) {
            throw new IllegalStateException("bridge.evm.proxy.host must be configured when bridge.evm.proxy.enabled=true");
        }

        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .proxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyHost, proxyPort)));
        if (proxyUsername != null && !proxyUsername.isBlank()) {
            String credential = okhttp3.Credentials.basic(proxyUsername, proxyPassword == null ? "" : proxyPassword);
            clientBuilder.proxyAuthenticator((Route route, Response response) -> {
                Request request = response.request();
                return request.newBuilder()
                        .header("Proxy-Authorization", credential)
                        .build();
            });
        }
        return Web3j.build(new HttpService(rpcUrl, clientBuilder.build(), false));
    }

    @Bean
    public Signer relayerSigner(@Value("${bridge.evm.private-key:}") String privateKey) {
        return new EvmSigner(privateKey);
    }

    @Bean
    public EvmChainSettings evmChainSettings(
            @Value("${bridge.evm.chain-id}") long chainId,
            @Value("${bridge.evm.initiator-contract}") String initiatorContract,
            @Value("${bridge.evm.counterparty-contract}") String counterpartyContract,
            @Value("${bridge.evm.poll-interval-ms:2000}") long pollIntervalMs,
            @Value("${bridge.evm.max-block-range:500}") int maxBlockRange,
            @Value("${bridge.evm.gas-limit:300000}") long gasLimit,
            @Value("${bridge.evm.max-priority-fee-per-gas:2000000000}") long maxPriorityFeePerGas,
            @Value("${bridge.evm.max-fee-per-gas:20000000000}") long maxFeePerGas,
            @Value("${bridge.evm.start-block:-1}") long startBlock) {
        return new EvmChainSettings(
                chainId,
                initiatorContract.trim(),
                counterpartyContract.trim(),
                pollIntervalMs,
                maxBlockRange,
                BigInteger.valueOf(gasLimit),
                BigInteger.valueOf(maxPriorityFeePerGas),
                BigInteger.valueOf(maxFeePerGas),
                startBlock < 0 ? null : BigInteger.valueOf(startBlock)
        );
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public EvmBlockchainService chainOne(Web3j web3j, Signer relayerSigner, EvmChainSettings evmChainSettings) {
        return new EvmBlockchainService(ChainNames.CHAIN_ONE, web3j, relayerSigner, evmChainSettings);
    }
}
