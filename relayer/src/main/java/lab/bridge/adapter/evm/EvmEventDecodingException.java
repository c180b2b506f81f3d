package lab.bridge.adapter.evm;

// A bridge contract log whose topics or data do not match the expected event layout.
public class EvmEventDecodingException extends RuntimeException {

    public EvmEventDecodingException(String message) {
        super(message);
    }

    public EvmEventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
