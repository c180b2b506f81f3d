package lab.bridge.domain.transfer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigInteger;

// Smallest unit of the bridged asset.
public record Amount(BigInteger value) {

    public Amount {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("amount must be a non-negative integer");
        }
    }

    public static Amount of(long value) {
        return new Amount(BigInteger.valueOf(value));
    }

    @JsonCreator
    public static Amount parse(String value) {
        try {
            return new Amount(new BigInteger(value.trim()));
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("invalid amount: " + value);
        }
    }

    @JsonValue
    public String toJson() {
        return value.toString();
    }
}
