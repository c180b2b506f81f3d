package lab.bridge.domain.transfer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * 32-byte account address. Short hex forms such as {@code 0x1} are left-padded.
 */
public final class MoveAddress implements ChainAddress {

    public static final int LENGTH = 32;

    private final byte[] value;

    private MoveAddress(byte[] value) {
        this.value = value;
    }

    public static MoveAddress of(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("Move address must be " + LENGTH + " bytes");
        }
        return new MoveAddress(value.clone());
    }

    @JsonCreator
    public static MoveAddress fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Invalid Move address: " + hex);
        }
        String digits = Numeric.cleanHexPrefix(hex.trim());
        if (digits.isEmpty() || digits.length() > LENGTH * 2 || !digits.matches("[a-fA-F0-9]+")) {
            throw new IllegalArgumentException("Invalid Move address: " + hex);
        }
        return of(Numeric.hexStringToByteArray("0".repeat(LENGTH * 2 - digits.length()) + digits));
    }

    @Override
    public byte[] toBytes() {
        return value.clone();
    }

    @Override
    @JsonValue
    public String toHex() {
        return Numeric.toHexString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MoveAddress other)) return false;
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
