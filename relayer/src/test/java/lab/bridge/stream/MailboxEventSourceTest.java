package lab.bridge.stream;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MailboxEventSourceTest {

    @Test
    void deliversItemsInPublishOrderAndNeverBlocks() {
        MailboxEventSource<String> source = new MailboxEventSource<>("test");

        assertThat(source.poll()).isEmpty();
        source.publish("a");
        source.publish("b");

        assertThat(source.pending()).isEqualTo(2);
        assertThat(source.poll()).contains("a");
        assertThat(source.poll()).contains("b");
        assertThat(source.poll()).isEmpty();
    }

    @Test
    void signalsListenersOnPublishAndFailure() {
        MailboxEventSource<String> source = new MailboxEventSource<>("test");
        AtomicInteger signals = new AtomicInteger();
        source.onReady(signals::incrementAndGet);

        source.publish("a");
        source.fail(new IllegalStateException("boom"));

        assertThat(signals).hasValue(2);
    }

    @Test
    void failure_deliversQueuedItemsThenRaisesOnceThenStaysEmpty() {
        MailboxEventSource<String> source = new MailboxEventSource<>("chain-one");
        source.publish("before");
        source.fail(new IllegalStateException("bad log"));
        source.publish("after");

        assertThat(source.poll()).contains("before");
        assertThat(source.isTerminated()).isFalse();
        assertThatThrownBy(source::poll)
                .isInstanceOf(EventStreamException.class)
                .hasMessageContaining("chain-one")
                .hasRootCauseMessage("bad log");
        assertThat(source.isTerminated()).isTrue();
        assertThat(source.poll()).isEmpty();
    }
}
