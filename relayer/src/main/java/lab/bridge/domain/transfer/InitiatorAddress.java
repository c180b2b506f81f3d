package lab.bridge.domain.transfer;

import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * Originator of a swap as recorded by the counterparty chain, in the initiating chain's format.
 */
public final class InitiatorAddress {

    private final byte[] value;

    private InitiatorAddress(byte[] value) {
        this.value = value;
    }

    public static InitiatorAddress of(byte[] value) {
        if (value == null || value.length == 0) {
            throw new IllegalArgumentException("initiator address must not be empty");
        }
        return new InitiatorAddress(value.clone());
    }

    public static InitiatorAddress fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("initiator address is blank");
        }
        return of(Numeric.hexStringToByteArray(hex.trim()));
    }

    public byte[] toBytes() {
        return value.clone();
    }

    @JsonValue
    public String toHex() {
        return Numeric.toHexString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InitiatorAddress other)) return false;
        return Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
