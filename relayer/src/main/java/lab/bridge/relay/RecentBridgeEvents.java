package lab.bridge.relay;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

// Bounded in-memory history of relay output for the operator API.
@Component
@Order(30)
public class RecentBridgeEvents implements BridgeEventSink {

    private final int capacity;
    private final Deque<BridgeEvent> events = new ArrayDeque<>();

    public RecentBridgeEvents(@Value("${bridge.relay.recent-events-capacity:500}") int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("bridge.relay.recent-events-capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void accept(BridgeEvent event) {
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    // Oldest first.
    public synchronized List<BridgeEvent> recent(int limit) {
        List<BridgeEvent> all = new ArrayList<>(events);
        int from = Math.max(0, all.size() - Math.max(limit, 0));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized void clear() {
        events.clear();
    }
}
