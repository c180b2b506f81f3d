package lab.bridge.domain.transfer;

import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * Recipient as recorded by the initiating chain: raw bytes in the destination chain's format.
 */
public final class RecipientAddress {

    private final byte[] value;

    private RecipientAddress(byte[] value) {
        this.value = value;
    }

    public static RecipientAddress of(byte[] value) {
        if (value == null || value.length == 0) {
            throw new IllegalArgumentException("recipient address must not be empty");
        }
        return new RecipientAddress(value.clone());
    }

    public static RecipientAddress fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("recipient address is blank");
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
        if (!(o instanceof RecipientAddress other)) return false;
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
