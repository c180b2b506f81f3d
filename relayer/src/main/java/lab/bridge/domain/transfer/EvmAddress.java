package lab.bridge.domain.transfer;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.regex.Pattern;

public final class EvmAddress implements ChainAddress {

    public static final int LENGTH = 20;

    private static final Pattern EVM_ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");

    private final byte[] value;

    private EvmAddress(byte[] value) {
        this.value = value;
    }

    public static EvmAddress of(byte[] value) {
        if (value == null || value.length != LENGTH) {
            throw new IllegalArgumentException("EVM address must be " + LENGTH + " bytes");
        }
        return new EvmAddress(value.clone());
    }

    @JsonCreator
    public static EvmAddress fromHex(String hex) {
        if (hex == null || !EVM_ADDRESS_PATTERN.matcher(hex.trim()).matches()) {
            throw new IllegalArgumentException("Invalid EVM address: " + hex);
        }
        return of(Numeric.hexStringToByteArray(hex.trim()));
    }

    @Override
    public byte[] toBytes() {
        return value.clone();
    }

    @Override
    @JsonValue
    public String toHex() {
        return Keys.toChecksumAddress(Numeric.toHexString(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvmAddress other)) return false;
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
