package com.reflow.ocr.infra;

import com.reflow.ocr.model.SessionEvent;
import com.reflow.ocr.model.SessionEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventBrokerTest {

    private InMemoryEventBroker broker;

    @BeforeEach
    void setUp() {
        broker = new InMemoryEventBroker();
    }

    @Test
    void shouldGreetNewSubscriberWithConnectedEvent() {
        UUID sessionId = UUID.randomUUID();

        BlockingQueue<SessionEvent> channel = broker.subscribe(sessionId);

        SessionEvent greeting = channel.poll();
        assertThat(greeting).isNotNull();
        assertThat(greeting.type()).isEqualTo(SessionEventType.CONNECTED);
        assertThat(greeting.get("sessionId")).isEqualTo(sessionId);
        assertThat(greeting.get("timestamp")).isNotNull();
    }

    @Test
    void shouldDeliverInPublishOrderToEverySubscriber() {
        UUID sessionId = UUID.randomUUID();
        BlockingQueue<SessionEvent> first = broker.subscribe(sessionId);
        BlockingQueue<SessionEvent> second = broker.subscribe(sessionId);

        for (int i = 0; i < 5; i++) {
            broker.publish(sessionId, SessionEvent.of(SessionEventType.PAGE_START).with("pageIndex", i));
        }

        assertThat(pageIndices(first)).containsExactly(0, 1, 2, 3, 4);
        assertThat(pageIndices(second)).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void shouldIsolateSessions() {
        UUID sessionA = UUID.randomUUID();
        UUID sessionB = UUID.randomUUID();
        BlockingQueue<SessionEvent> channelA = broker.subscribe(sessionA);
        BlockingQueue<SessionEvent> channelB = broker.subscribe(sessionB);

        broker.publish(sessionA, SessionEvent.of(SessionEventType.TASK_COMPLETED));

        assertThat(channelA).hasSize(2);
        assertThat(channelB).hasSize(1);
    }

    @Test
    void shouldStopDeliveringAfterUnsubscribe() {
        UUID sessionId = UUID.randomUUID();
        BlockingQueue<SessionEvent> channel = broker.subscribe(sessionId);
        channel.clear();

        broker.unsubscribe(sessionId, channel);
        broker.publish(sessionId, SessionEvent.of(SessionEventType.TASK_STARTED));

        assertThat(channel).isEmpty();
        assertThat(broker.subscriberCount(sessionId)).isZero();
    }

    @Test
    void shouldDropEventsWithoutSubscribers() {
        UUID sessionId = UUID.randomUUID();

        broker.publish(sessionId, SessionEvent.of(SessionEventType.TASK_STARTED));
        BlockingQueue<SessionEvent> late = broker.subscribe(sessionId);

        assertThat(late).extracting(SessionEvent::type).containsExactly(SessionEventType.CONNECTED);
    }

    private static List<Object> pageIndices(BlockingQueue<SessionEvent> channel) {
        List<SessionEvent> drained = new ArrayList<>();
        channel.drainTo(drained);
        return drained.stream()
            .filter(event -> event.type() == SessionEventType.PAGE_START)
            .map(event -> event.get("pageIndex"))
            .toList();
    }
}
