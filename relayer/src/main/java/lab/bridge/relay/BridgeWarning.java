package lab.bridge.relay;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lab.bridge.domain.transfer.BridgeTransferId;

import java.time.Instant;
import java.util.Optional;

/**
 * @param source     origin tag ({@code B1I}, {@code B2C}, ...), direction label or chain name
 * @param bridgeTransferId null for warnings that are not about a single swap
 * @param detail     event details or call error behind the warning
 */
@JsonTypeName("Warn")
public record BridgeWarning(
        WarningKind kind,
        WarningSeverity severity,
        String source,
        BridgeTransferId bridgeTransferId,
        Object detail,
        String message,
        Instant occurredAt
) implements BridgeEvent {

    @Override
    @JsonIgnore
    public Optional<BridgeTransferId> transferId() {
        return Optional.ofNullable(bridgeTransferId);
    }

    @JsonIgnore
    public boolean isCritical() {
        return severity == WarningSeverity.CRITICAL;
    }
}
