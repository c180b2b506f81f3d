package lab.bridge.stream;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mailbox-backed {@link EventSource}. Producers publish from any thread; a single consumer polls.
 * Items keep their publish order.
 */
@Slf4j
public class MailboxEventSource<T> implements EventSource<T> {

    private enum State {
        OPEN,
        FAILED,
        TERMINATED
    }

    private final String name;
    private final Queue<T> mailbox = new ConcurrentLinkedQueue<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);
    private volatile Throwable failure;

    public MailboxEventSource(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public void publish(T item) {
        if (state.get() != State.OPEN) {
            log.debug("event=mailbox.publish.dropped source={} state={}", name, state.get());
            return;
        }
        mailbox.add(item);
        signal();
    }

    /**
     * Terminates the source. Items published before the failure are still delivered first.
     */
    public void fail(Throwable cause) {
        if (state.compareAndSet(State.OPEN, State.FAILED)) {
            failure = cause;
            log.warn("event=mailbox.failed source={} cause={}", name, cause.getMessage());
            signal();
        }
    }

    @Override
    public Optional<T> poll() {
        T next = mailbox.poll();
        if (next != null) {
            return Optional.of(next);
        }
        if (state.compareAndSet(State.FAILED, State.TERMINATED)) {
            throw new EventStreamException("event source " + name + " terminated: " + failure.getMessage(), failure);
        }
        return Optional.empty();
    }

    @Override
    public boolean isTerminated() {
        return state.get() == State.TERMINATED;
    }

    @Override
    public void onReady(Runnable listener) {
        listeners.add(listener);
    }

    public int pending() {
        return mailbox.size();
    }

    private void signal() {
        for (Runnable listener : listeners) {
            listener.run();
        }
    }
}
