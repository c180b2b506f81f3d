package lab.bridge.domain.transfer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * Secret revealed by the recipient when claiming on the counterparty chain.
 */
public final class HashLockPreImage {

    private final byte[] value;

    private HashLockPreImage(byte[] value) {
        this.value = value;
    }

    public static HashLockPreImage of(byte[] value) {
        if (value == null || value.length == 0) {
            throw new IllegalArgumentException("pre-image must not be empty");
        }
        return new HashLockPreImage(value.clone());
    }

    @JsonCreator
    public static HashLockPreImage fromHex(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("pre-image is blank");
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
        if (!(o instanceof HashLockPreImage other)) return false;
        return Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    // Secrets end up in log lines through the details records.
    @Override
    public String toString() {
        return "HashLockPreImage[" + value.length + " bytes]";
    }
}
