package lab.bridge.stream;

// Fatal failure of one event source, e.g. a chain log that cannot be decoded.
public class EventStreamException extends RuntimeException {

    public EventStreamException(String message) {
        super(message);
    }

    public EventStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
