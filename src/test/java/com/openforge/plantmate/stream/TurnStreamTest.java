package com.openforge.plantmate.stream;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TurnStreamTest {

    @Test
    void eventsArriveInOrder() throws Exception {
        TurnStream stream = new TurnStream("s1", 8, Duration.ofSeconds(1));

        stream.publish(StreamEvent.status("Analysing the request..."));
        stream.publish(StreamEvent.token("Hello"));
        stream.publish(StreamEvent.done("m-1"));

        assertThat(stream.poll(Duration.ZERO).type()).isEqualTo(EventType.STATUS);
        assertThat(stream.poll(Duration.ZERO).content()).isEqualTo("Hello");
        assertThat(stream.poll(Duration.ZERO).messageId()).isEqualTo("m-1");
        assertThat(stream.poll(Duration.ofMillis(10))).isNull();
    }

    @Test
    void onlyOneTerminalEventIsAccepted() throws Exception {
        TurnStream stream = new TurnStream("s1", 8, Duration.ofSeconds(1));

        assertThat(stream.publish(StreamEvent.done("m-1"))).isTrue();
        assertThat(stream.publish(StreamEvent.error("late failure"))).isFalse();
        assertThat(stream.publish(StreamEvent.token("late token"))).isFalse();

        assertThat(stream.isTerminated()).isTrue();
        assertThat(stream.poll(Duration.ZERO).type()).isEqualTo(EventType.DONE);
        assertThat(stream.poll(Duration.ZERO)).isNull();
    }

    @Test
    void fullBufferCancelsTurnAfterPublishTimeout() {
        TurnStream stream = new TurnStream("s1", 1, Duration.ofMillis(50));
        AtomicInteger hookRuns = new AtomicInteger();
        stream.onCancel(hookRuns::incrementAndGet);

        assertThat(stream.publish(StreamEvent.token("a"))).isTrue();
        assertThat(stream.publish(StreamEvent.token("b"))).isFalse();

        assertThat(stream.isCancelled()).isTrue();
        assertThat(hookRuns).hasValue(1);
        assertThat(stream.publish(StreamEvent.done("m-1"))).isFalse();
    }

    @Test
    void cancelRunsHookOnceAndClearsBuffer() throws Exception {
        TurnStream stream = new TurnStream("s1", 8, Duration.ofSeconds(1));
        AtomicInteger hookRuns = new AtomicInteger();
        stream.onCancel(hookRuns::incrementAndGet);
        stream.publish(StreamEvent.status("working"));

        stream.cancel();
        stream.cancel();

        assertThat(hookRuns).hasValue(1);
        assertThat(stream.poll(Duration.ZERO)).isNull();
    }

    @Test
    void hookRegisteredAfterCancelRunsImmediately() {
        TurnStream stream = new TurnStream("s1", 8, Duration.ofSeconds(1));
        stream.cancel();
        AtomicInteger hookRuns = new AtomicInteger();

        stream.onCancel(hookRuns::incrementAndGet);

        assertThat(hookRuns).hasValue(1);
    }

    @Test
    void interruptedPublisherKeepsInterruptFlag() {
        TurnStream stream = new TurnStream("s1", 1, Duration.ofSeconds(5));
        stream.publish(StreamEvent.token("a"));

        Thread.currentThread().interrupt();
        try {
            assertThat(stream.publish(StreamEvent.token("b"))).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
