package com.reflow.ocr.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reflow.ocr.infra.EventBroker;
import com.reflow.ocr.model.SessionEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live feed of {@code data: <json>\n\n} frames for one session. Subscribes on
 * construction; yields a heartbeat whenever nothing arrives within the timeout and
 * ends after the first terminal task event. Closing releases the subscription, so
 * consumers must close it even when they stop reading early.
 */
@Slf4j
public class SessionEventStream implements Iterator<String>, AutoCloseable {

    private final UUID sessionId;
    private final EventBroker eventBroker;
    private final ObjectMapper objectMapper;
    private final long heartbeatMillis;
    private final BlockingQueue<SessionEvent> channel;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean finished;

    public SessionEventStream(UUID sessionId, EventBroker eventBroker, ObjectMapper objectMapper, Duration heartbeatTimeout) {
        this.sessionId = sessionId;
        this.eventBroker = eventBroker;
        this.objectMapper = objectMapper;
        this.heartbeatMillis = heartbeatTimeout.toMillis();
        this.channel = eventBroker.subscribe(sessionId);
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public String next() {
        if (finished) {
            throw new NoSuchElementException("Event stream for session " + sessionId + " has ended");
        }
        SessionEvent event;
        try {
            event = channel.poll(heartbeatMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = true;
            close();
            throw new CancellationException("Event stream for session " + sessionId + " interrupted");
        }
        if (event == null) {
            event = SessionEvent.heartbeat(sessionId);
        }
        if (event.type().isTerminal()) {
            finished = true;
            close();
        }
        return toFrame(event);
    }

    private String toFrame(SessionEvent event) {
        try {
            return "data: " + objectMapper.writeValueAsString(event) + "\n\n";
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + event, e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            eventBroker.unsubscribe(sessionId, channel);
            log.debug("Session {}: event stream closed", sessionId);
        }
    }
}
