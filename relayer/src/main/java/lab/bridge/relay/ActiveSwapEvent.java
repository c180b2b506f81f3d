package lab.bridge.relay;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lab.bridge.domain.transfer.BridgeTransferId;

/**
 * Outcome of a contract call dispatched by an {@link ActiveSwapTracker}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "outcome")
public interface ActiveSwapEvent {

    BridgeTransferId bridgeTransferId();

    default boolean failed() {
        return false;
    }

    @JsonTypeName("AssetsLocked")
    record AssetsLocked(BridgeTransferId bridgeTransferId, String txHash) implements ActiveSwapEvent {}

    @JsonTypeName("AssetsLockingError")
    record AssetsLockingError(ActiveSwapError error) implements ActiveSwapEvent {
        @Override
        public BridgeTransferId bridgeTransferId() {
            return error.bridgeTransferId();
        }

        @Override
        public boolean failed() {
            return true;
        }
    }

    @JsonTypeName("AssetsCompleted")
    record AssetsCompleted(BridgeTransferId bridgeTransferId, String txHash) implements ActiveSwapEvent {}

    @JsonTypeName("AssetsCompletingError")
    record AssetsCompletingError(ActiveSwapError error) implements ActiveSwapEvent {
        @Override
        public BridgeTransferId bridgeTransferId() {
            return error.bridgeTransferId();
        }

        @Override
        public boolean failed() {
            return true;
        }
    }

    @JsonTypeName("AssetsAborted")
    record AssetsAborted(BridgeTransferId bridgeTransferId, String txHash) implements ActiveSwapEvent {}

    @JsonTypeName("AssetsAbortingError")
    record AssetsAbortingError(ActiveSwapError error) implements ActiveSwapEvent {
        @Override
        public BridgeTransferId bridgeTransferId() {
            return error.bridgeTransferId();
        }

        @Override
        public boolean failed() {
            return true;
        }
    }
}
