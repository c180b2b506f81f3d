package lab.bridge.chain;

import lab.bridge.domain.transfer.EvmAddress;
import lab.bridge.domain.transfer.InitiatorAddress;
import lab.bridge.domain.transfer.MoveAddress;
import lab.bridge.domain.transfer.RecipientAddress;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvmMoveChainPairTest {

    private final EvmMoveChainPair pair = new EvmMoveChainPair();

    @Test
    void evmInitiator_isLeftPaddedForTheMoveChain() {
        EvmAddress evm = EvmAddress.fromHex("0x00000000000000000000000000000000000000ff");

        InitiatorAddress initiator = pair.oneToTwo().toInitiator(evm);

        assertThat(initiator.toBytes()).hasSize(32);
        assertThat(initiator.toHex()).isEqualTo("0x" + "0".repeat(62) + "ff");
    }

    @Test
    void shortMoveRecipient_isPaddedToAFullAddress() {
        MoveAddress recipient = pair.oneToTwo().toRecipient(RecipientAddress.fromHex("0x0b0b"));

        assertThat(recipient).isEqualTo(MoveAddress.fromHex("0xb0b"));
    }

    @Test
    void oversizedRecipient_cannotBeAMoveAddress() {
        RecipientAddress tooLong = RecipientAddress.of(new byte[33]);

        assertThatThrownBy(() -> pair.oneToTwo().toRecipient(tooLong)).isInstanceOf(AddressConversionException.class);
    }

    @Test
    void evmRecipient_acceptsRawAndZeroPaddedForms() {
        EvmAddress expected = EvmAddress.fromHex("0x2222222222222222222222222222222222222222");

        assertThat(pair.twoToOne().toRecipient(RecipientAddress.of(expected.toBytes()))).isEqualTo(expected);
        assertThat(pair.twoToOne().toRecipient(RecipientAddress.fromHex("0x" + "0".repeat(24) + "2222222222222222222222222222222222222222")))
                .isEqualTo(expected);
    }

    @Test
    void evmRecipient_rejectsValuesThatDoNotFitTwentyBytes() {
        RecipientAddress full = RecipientAddress.fromHex("0x" + "1".repeat(64));
        RecipientAddress odd = RecipientAddress.of(new byte[25]);

        assertThatThrownBy(() -> pair.twoToOne().toRecipient(full)).isInstanceOf(AddressConversionException.class);
        assertThatThrownBy(() -> pair.twoToOne().toRecipient(odd)).isInstanceOf(AddressConversionException.class);
    }

    @Test
    void moveInitiator_isKeptAsIs() {
        MoveAddress move = MoveAddress.fromHex("0xa11ce");

        assertThat(pair.twoToOne().toInitiator(move).toBytes()).isEqualTo(move.toBytes());
    }
}
