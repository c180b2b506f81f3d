package lab.bridge.stream;

import java.util.Optional;

/**
 * Lazy, unbounded, non-restartable sequence of items that can be polled without blocking.
 *
 * <p>{@link #poll()} returns the next ready item or empty when nothing is ready yet. A source that has
 * failed raises {@link EventStreamException} from the first poll after the failure and then stays
 * terminated, returning empty forever.
 */
public interface EventSource<T> {

    Optional<T> poll();

    boolean isTerminated();

    /**
     * Registers a callback fired whenever new data may be available. Callbacks must not block.
     */
    void onReady(Runnable listener);
}
