package lab.bridge.adapter.evm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
@ConditionalOnProperty(prefix = "bridge.chain-one", name = "mode", havingValue = "rpc")
@Slf4j
public class RpcModeStartupGuard {

    private static final Pattern CONTRACT_ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    @Value("${bridge.evm.chain-id}")
    private long chainId;

    @Value("${bridge.evm.private-key:}")
    private String privateKey;

    @Value("${bridge.evm.rpc-url:}")
    private String rpcUrl;

    @Value("${bridge.evm.initiator-contract:}")
    private String initiatorContract;

    @Value("${bridge.evm.counterparty-contract:}")
    private String counterpartyContract;

    @PostConstruct
    void validate() {
        if (chainId == 1) {
            throw new IllegalStateException("Mainnet(chain-id=1) is not allowed for the relayer in rpc mode");
        }
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("BRIDGE_EVM_PRIVATE_KEY must be configured in rpc mode");
        }
        if (rpcUrl == null || rpcUrl.isBlank()) {
            throw new IllegalStateException("BRIDGE_EVM_RPC_URL must be configured in rpc mode");
        }
        requireContract("bridge.evm.initiator-contract", initiatorContract);
        requireContract("bridge.evm.counterparty-contract", counterpartyContract);
        if (initiatorContract.equalsIgnoreCase(counterpartyContract)) {
            throw new IllegalStateException("initiator and counterparty contracts must be distinct");
        }
        log.info("event=rpc_guard.ok chainId={} initiator={} counterparty={}", chainId, initiatorContract, counterpartyContract);
    }

    private static void requireContract(String key, String value) {
        if (value == null || !CONTRACT_ADDRESS_PATTERN.matcher(value.trim()).matches()) {
            throw new IllegalStateException(key + " must be a 0x-prefixed 20-byte address in rpc mode");
        }
    }
}
