package lab.bridge.chain;

/**
 * Contract call that failed or was rejected by the chain. Trackers treat it as retryable.
 */
public class ContractCallException extends RuntimeException {

    public ContractCallException(String message) {
        super(message);
    }

    public ContractCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
