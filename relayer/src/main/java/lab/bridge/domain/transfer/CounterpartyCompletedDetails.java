package lab.bridge.domain.transfer;

import java.util.Objects;

// The recipient claimed the counterparty lock and revealed the secret.
public record CounterpartyCompletedDetails(
        BridgeTransferId bridgeTransferId,
        HashLockPreImage secret
) {
    public CounterpartyCompletedDetails {
        Objects.requireNonNull(bridgeTransferId, "bridgeTransferId");
        Objects.requireNonNull(secret, "secret");
    }
}
