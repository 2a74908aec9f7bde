package com.reflow.ocr.infra;

import com.reflow.ocr.model.SessionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

@Slf4j
@Component
public class InMemoryEventBroker implements EventBroker {

    private final ConcurrentHashMap<UUID, Set<BlockingQueue<SessionEvent>>> subscribers = new ConcurrentHashMap<>();

    @Override
    public BlockingQueue<SessionEvent> subscribe(UUID sessionId) {
        BlockingQueue<SessionEvent> channel = new LinkedBlockingQueue<>();
        channel.offer(SessionEvent.connected(sessionId));
        subscribers.compute(sessionId, (id, channels) -> {
            Set<BlockingQueue<SessionEvent>> target = channels != null ? channels : ConcurrentHashMap.newKeySet();
            target.add(channel);
            return target;
        });
        log.debug("Session {}: subscriber added", sessionId);
        return channel;
    }

    @Override
    public void unsubscribe(UUID sessionId, BlockingQueue<SessionEvent> channel) {
        subscribers.computeIfPresent(sessionId, (id, channels) -> {
            channels.remove(channel);
            return channels.isEmpty() ? null : channels;
        });
        log.debug("Session {}: subscriber removed", sessionId);
    }

    @Override
    public void publish(UUID sessionId, SessionEvent event) {
        Set<BlockingQueue<SessionEvent>> channels = subscribers.get(sessionId);
        if (channels == null) {
            log.trace("Session {}: no subscribers for {}", sessionId, event.event());
            return;
        }
        channels.forEach(channel -> channel.offer(event));
    }

    @Override
    public int subscriberCount(UUID sessionId) {
        Set<BlockingQueue<SessionEvent>> channels = subscribers.get(sessionId);
        return channels == null ? 0 : channels.size();
    }
}
