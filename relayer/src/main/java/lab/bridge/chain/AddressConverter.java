package lab.bridge.chain;

import lab.bridge.domain.transfer.ChainAddress;
import lab.bridge.domain.transfer.InitiatorAddress;
import lab.bridge.domain.transfer.RecipientAddress;

/**
 * Maps addresses of a swap initiated on the chain using {@code S} to the chain using {@code D}.
 *
 * @param <S> address type of the initiating chain
 * @param <D> address type of the counterparty chain
 */
public interface AddressConverter<S extends ChainAddress, D extends ChainAddress> {

    /**
     * Interprets the recipient bytes recorded on the initiating chain as a counterparty-chain address.
     *
     * @throws AddressConversionException when the bytes are not a valid {@code D}
     */
    D toRecipient(RecipientAddress recipient);

    InitiatorAddress toInitiator(S initiator);
}
