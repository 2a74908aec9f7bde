package com.reflow.ocr.infra;

import com.reflow.ocr.model.SessionEvent;

import java.util.UUID;
import java.util.concurrent.BlockingQueue;

/**
 * Per-session fan-out of progress events. Delivery is best effort and FIFO per
 * channel; a channel only sees events published while it is subscribed.
 */
public interface EventBroker {

    /**
     * Registers a new unbounded channel; it already holds a {@code connected} event.
     */
    BlockingQueue<SessionEvent> subscribe(UUID sessionId);

    void unsubscribe(UUID sessionId, BlockingQueue<SessionEvent> channel);

    void publish(UUID sessionId, SessionEvent event);

    int subscriberCount(UUID sessionId);
}
