package com.navcaddy.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for conversation analytics events.
 * <p>
 * Session listeners (the per-session event stream) only see their own session; global listeners
 * (the analytics log) see everything. A failing listener never breaks delivery to the others or
 * the publishing turn.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<AnalyticsEvent>>> bySession = new ConcurrentHashMap<>();
    private final List<Consumer<AnalyticsEvent>> global = new CopyOnWriteArrayList<>();

    public void publish(AnalyticsEvent event) {
        log.trace("Publishing {} for session {}", event.eventType(), event.sessionId());
        if (event.sessionId() != null) {
            for (Consumer<AnalyticsEvent> listener : bySession.getOrDefault(event.sessionId(), List.of())) {
                deliverSafely(listener, event);
            }
        }
        for (Consumer<AnalyticsEvent> listener : global) {
            deliverSafely(listener, event);
        }
    }

    /**
     * Listens to one session's events until unsubscribed or the session is removed.
     */
    public Subscription subscribe(String sessionId, Consumer<AnalyticsEvent> listener) {
        bySession.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> bySession.computeIfPresent(sessionId, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<AnalyticsEvent> listener) {
        global.add(listener);
        return () -> global.remove(listener);
    }

    /** Drops every listener of an ended session. */
    public void removeSession(String sessionId) {
        bySession.remove(sessionId);
    }

    public int sessionListenerCount(String sessionId) {
        return bySession.getOrDefault(sessionId, List.of()).size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliverSafely(Consumer<AnalyticsEvent> listener, AnalyticsEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for session {}: {}", event.eventType(), event.sessionId(),
                    e.getMessage(), e);
        }
    }
}
