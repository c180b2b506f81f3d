package lab.bridge.domain.transfer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * Identifier the initiator contract assigns to a swap attempt. Always 32 bytes.
 * Unique only within one relay direction.
 */
public final class BridgeTransferId {

    public static final int LENGTH = 32;

    private final byte[] value;

    private BridgeTransferId(byte[] value) {
        this.value = value;
    }

    public static BridgeTransferId of(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("bridge transfer id must be " + LENGTH + " bytes");
        }
        return new BridgeTransferId(value.clone());
    }

    @JsonCreator
    public static BridgeTransferId fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("bridge transfer id is blank");
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
        if (!(o instanceof BridgeTransferId other)) return false;
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
