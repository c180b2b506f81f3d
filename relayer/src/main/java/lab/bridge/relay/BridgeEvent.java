package lab.bridge.relay;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lab.bridge.domain.transfer.BridgeTransferId;

import java.time.Instant;
import java.util.Optional;

/**
 * Unified output of the {@link BridgeService}, consumed by logging, alerting and operator tooling.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
public interface BridgeEvent {

    Instant occurredAt();

    Optional<BridgeTransferId> transferId();
}
