package lab.bridge.chain;

import lab.bridge.domain.transfer.EvmAddress;
import lab.bridge.domain.transfer.InitiatorAddress;
import lab.bridge.domain.transfer.MoveAddress;
import lab.bridge.domain.transfer.RecipientAddress;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * EVM chain (one) paired with a Move chain (two). EVM addresses travel as 32-byte words, left-padded
 * with zeros; a 32-byte value is an EVM address only if its 12 leading bytes are zero.
 */
@Component
public class EvmMoveChainPair implements BridgeChainPair<EvmAddress, MoveAddress> {

    private static final int PADDING = MoveAddress.LENGTH - EvmAddress.LENGTH;

    private final AddressConverter<EvmAddress, MoveAddress> oneToTwo = new AddressConverter<>() {
        @Override
        public MoveAddress toRecipient(RecipientAddress recipient) {
            byte[] raw = recipient.toBytes();
            if (raw.length > MoveAddress.LENGTH) {
                throw new AddressConversionException("recipient " + recipient + " is longer than a Move address");
            }
            return MoveAddress.of(leftPad(raw, MoveAddress.LENGTH));
        }

        @Override
        public InitiatorAddress toInitiator(EvmAddress initiator) {
            return InitiatorAddress.of(leftPad(initiator.toBytes(), MoveAddress.LENGTH));
        }
    };

    private final AddressConverter<MoveAddress, EvmAddress> twoToOne = new AddressConverter<>() {
        @Override
        public EvmAddress toRecipient(RecipientAddress recipient) {
            byte[] raw = recipient.toBytes();
            if (raw.length == EvmAddress.LENGTH) {
                return EvmAddress.of(raw);
            }
            if (raw.length != MoveAddress.LENGTH) {
                throw new AddressConversionException("recipient " + recipient + " is neither 20 nor 32 bytes");
            }
            for (int i = 0; i < PADDING; i++) {
                if (raw[i] != 0) {
                    throw new AddressConversionException("recipient " + recipient + " does not fit an EVM address");
                }
            }
            return EvmAddress.of(Arrays.copyOfRange(raw, PADDING, MoveAddress.LENGTH));
        }

        @Override
        public InitiatorAddress toInitiator(MoveAddress initiator) {
            return InitiatorAddress.of(initiator.toBytes());
        }
    };

    @Override
    public AddressConverter<EvmAddress, MoveAddress> oneToTwo() {
        return oneToTwo;
    }

    @Override
    public AddressConverter<MoveAddress, EvmAddress> twoToOne() {
        return twoToOne;
    }

    private static byte[] leftPad(byte[] raw, int length) {
        byte[] padded = new byte[length];
        System.arraycopy(raw, 0, padded, length - raw.length, raw.length);
        return padded;
    }
}
