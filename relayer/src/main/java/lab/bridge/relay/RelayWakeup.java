package lab.bridge.relay;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Ready signal shared by every upstream source of the relay. Signals raised while the relay thread is
 * busy are remembered, so a {@link #await} that follows a drain returns at once if anything arrived.
 */
public class RelayWakeup {

    private final Semaphore permits = new Semaphore(0);

    public void signal() {
        permits.release();
    }

    // Forget signals already covered by the drain that is about to start.
    public void reset() {
        permits.drainPermits();
    }

    /**
     * @return true if a signal arrived, false on timeout
     */
    public boolean await(long timeoutMs) throws InterruptedException {
        return permits.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
    }
}
