package lab.bridge.domain.transfer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * Hash-lock commitment shared by both legs of a swap. The relayer never derives it, it only copies it
 * from the initiating chain to the counterparty lock call.
 */
public final class HashLock {

    public static final int LENGTH = 32;

    private final byte[] value;

    private HashLock(byte[] value) {
        this.value = value;
    }

    public static HashLock of(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("hash lock must be " + LENGTH + " bytes");
        }
        return new HashLock(value.clone());
    }

    @JsonCreator
    public static HashLock fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("hash lock is blank");
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
        if (!(o instanceof HashLock other)) return false;
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
