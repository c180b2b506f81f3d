package lab.bridge.adapter.evm;

import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.utils.Numeric;

// Relayer hot key: pays gas for lock, claim and abort calls on chain one.
public class EvmSigner implements Signer {

    private final Credentials credentials;

    public EvmSigner(String privateKey) {
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("bridge.evm.private-key must be configured when bridge.chain-one.mode=rpc");
        }
        this.credentials = Credentials.create(privateKey.trim());
    }

    @Override
    public String sign(RawTransaction tx, long chainId) {
        byte[] signed = TransactionEncoder.signMessage(tx, chainId, credentials);
        return Numeric.toHexString(signed);
    }

    @Override
    public String getAddress() {
        return credentials.getAddress();
    }
}
