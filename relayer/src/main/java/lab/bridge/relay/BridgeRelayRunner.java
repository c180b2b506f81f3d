package lab.bridge.relay;

import lab.bridge.domain.transfer.ChainAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Drives the {@link BridgeService} on a single thread: runs turns until nothing is ready, hands every
 * output to the sinks, then parks until a source signals new data. Stopping the runner stops the relay.
 */
@Component
@Slf4j
public class BridgeRelayRunner implements SmartLifecycle {

    private final BridgeService<? extends ChainAddress, ? extends ChainAddress> bridgeService;
    private final List<BridgeEventSink> sinks;
    private final boolean autoStartup;
    private final long idleWaitMs;

    private final RelayWakeup wakeup = new RelayWakeup();
    private final Object turnLock = new Object();
    private volatile boolean running;
    private ExecutorService executor;

    public BridgeRelayRunner(
            BridgeService<? extends ChainAddress, ? extends ChainAddress> bridgeService,
            List<BridgeEventSink> sinks,
            @Value("${bridge.relay.enabled:true}") boolean autoStartup,
            @Value("${bridge.relay.idle-wait-ms:500}") long idleWaitMs
    ) {
        this.bridgeService = bridgeService;
        this.sinks = sinks;
        this.autoStartup = autoStartup;
        this.idleWaitMs = Math.max(idleWaitMs, 10L);
        bridgeService.onReady(wakeup::signal);
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "bridge-relay");
            thread.setDaemon(true);
            return thread;
        });
        executor.submit(this::relayLoop);
        log.info("event=bridge_relay.started idleWaitMs={} sinks={}", idleWaitMs, sinks.size());
    }

    @Override
    public void stop() {
        running = false;
        wakeup.signal();
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
        log.info("event=bridge_relay.stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    /**
     * Runs turns until the service reports nothing ready. Returns the number of events dispatched.
     */
    public int pump() {
        synchronized (turnLock) {
            int dispatched = 0;
            Optional<BridgeEvent> next = bridgeService.poll();
            while (next.isPresent()) {
                dispatch(next.get());
                dispatched++;
                next = bridgeService.poll();
            }
            return dispatched;
        }
    }

    private void relayLoop() {
        while (running) {
            wakeup.reset();
            try {
                pump();
            } catch (RuntimeException e) {
                // The event that caused this is lost; the relay keeps serving the others.
                log.error("event=bridge_relay.turn_failed reason={}", e.getMessage(), e);
            }
            try {
                wakeup.await(idleWaitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("event=bridge_relay.interrupted");
                return;
            }
        }
    }

    private void dispatch(BridgeEvent event) {
        for (BridgeEventSink sink : sinks) {
            try {
                sink.accept(event);
            } catch (RuntimeException e) {
                log.error("event=bridge_relay.sink_failed sink={} eventType={} reason={}",
                        sink.getClass().getSimpleName(), event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
