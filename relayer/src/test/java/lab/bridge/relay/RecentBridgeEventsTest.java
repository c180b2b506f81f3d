package lab.bridge.relay;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecentBridgeEventsTest {

    @Test
    void keepsTheNewestEventsUpToCapacity() {
        RecentBridgeEvents recent = new RecentBridgeEvents(2);
        BridgeWarning first = warning("first");
        BridgeWarning second = warning("second");
        BridgeWarning third = warning("third");

        recent.accept(first);
        recent.accept(second);
        recent.accept(third);

        assertThat(recent.recent(10)).containsExactly(second, third);
        assertThat(recent.recent(1)).containsExactly(third);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new RecentBridgeEvents(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static BridgeWarning warning(String message) {
        return new BridgeWarning(WarningKind.SOURCE_TERMINATED, WarningSeverity.CRITICAL, "chain-two", null, null, message, Instant.EPOCH);
    }
}
