package com.vibeforge.core.event;

import java.time.Instant;
import java.util.UUID;

public class Event {

    private final String    eventId;
    private final EventType type;
    private final String    source;

    // request id the event belongs to; null for events not tied to one request
    private final String    requestId;

    // step text, chunk text, artifact id or audit id depending on type
    private final Object    payload;

    private final Instant   timestamp;

    public Event(EventType type, String source, String requestId, Object payload) {
        this.eventId   = UUID.randomUUID().toString();
        this.type      = type;
        this.source    = source;
        this.requestId = requestId;
        this.payload   = payload;
        this.timestamp = Instant.now();
    }

    public String getEventId() {
        return eventId;
    }

    public EventType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public String getRequestId() {
        return requestId;
    }

    public Object getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Event{" + type + ", source=" + source + ", request=" + requestId + "}";
    }
}
