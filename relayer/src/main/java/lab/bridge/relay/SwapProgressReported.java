package lab.bridge.relay;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lab.bridge.domain.transfer.BridgeTransferId;

import java.time.Instant;
import java.util.Optional;

// Successful contract call dispatched by a tracker.
@JsonTypeName("SwapProgress")
public record SwapProgressReported(
        SwapDirection direction,
        ActiveSwapEvent progress,
        Instant occurredAt
) implements BridgeEvent {

    @Override
    @JsonIgnore
    public Optional<BridgeTransferId> transferId() {
        return Optional.of(progress.bridgeTransferId());
    }
}
