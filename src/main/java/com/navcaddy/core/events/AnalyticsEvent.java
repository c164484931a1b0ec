package com.navcaddy.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A conversation analytics event.
 *
 * @param eventType event type (e.g. "input.received", "intent.classified", "error.occurred")
 * @param sessionId the session this event belongs to
 * @param payload   key-value data; never carries the raw user input
 * @param timestamp when the event occurred
 */
public record AnalyticsEvent(
    String eventType,
    String sessionId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public AnalyticsEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }
}
