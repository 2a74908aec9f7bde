package com.reflow.ocr.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Progress message delivered to session subscribers. Serializes as one flat JSON
 * object: the {@code event} tag followed by the attributes.
 */
public final class SessionEvent {

    private final SessionEventType type;
    private final Map<String, Object> attributes;

    private SessionEvent(SessionEventType type, Map<String, Object> attributes) {
        this.type = type;
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    public static SessionEvent of(SessionEventType type) {
        return new SessionEvent(type, new LinkedHashMap<>());
    }

    public static SessionEvent connected(UUID sessionId) {
        return of(SessionEventType.CONNECTED).with("sessionId", sessionId).withTimestamp();
    }

    public static SessionEvent heartbeat(UUID sessionId) {
        return of(SessionEventType.HEARTBEAT).with("sessionId", sessionId).withTimestamp();
    }

    public SessionEvent with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new SessionEvent(type, copy);
    }

    public SessionEvent withTimestamp() {
        return with("timestamp", OffsetDateTime.now(ZoneOffset.UTC));
    }

    @JsonIgnore
    public SessionEventType type() {
        return type;
    }

    @JsonProperty("event")
    public String event() {
        return type.wireName();
    }

    @JsonAnyGetter
    public Map<String, Object> attributes() {
        return attributes;
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    @Override
    public String toString() {
        return "SessionEvent[" + type.wireName() + " " + attributes + "]";
    }
}
