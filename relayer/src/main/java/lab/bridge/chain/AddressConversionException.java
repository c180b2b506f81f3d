package lab.bridge.chain;

public class AddressConversionException extends RuntimeException {

    public AddressConversionException(String message) {
        super(message);
    }
}
