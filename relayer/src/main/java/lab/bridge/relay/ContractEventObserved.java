package lab.bridge.relay;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lab.bridge.chain.ContractEvent;
import lab.bridge.domain.transfer.BridgeTransferId;

import java.time.Instant;
import java.util.Optional;

// A chain contract event the relay acted upon or passes through, tagged with where it was observed.
@JsonTypeName("ContractEvent")
public record ContractEventObserved(
        EventOrigin origin,
        ContractEvent<?> event,
        Instant occurredAt
) implements BridgeEvent {

    @Override
    @JsonIgnore
    public Optional<BridgeTransferId> transferId() {
        return Optional.of(event.bridgeTransferId());
    }

    public String eventName() {
        return event.getClass().getSimpleName();
    }
}
