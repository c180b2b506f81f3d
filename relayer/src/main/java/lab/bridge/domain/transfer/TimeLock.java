package lab.bridge.domain.transfer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

// Refund deadline in seconds, as recorded by the contract.
public record TimeLock(long seconds) {

    public TimeLock {
        if (seconds < 0) {
            throw new IllegalArgumentException("time lock must not be negative");
        }
    }

    @JsonCreator
    public static TimeLock of(long seconds) {
        return new TimeLock(seconds);
    }

    @JsonValue
    public long toJson() {
        return seconds;
    }
}
