package com.navcaddy.dispatch.api;

import com.navcaddy.core.events.AnalyticsEvent;
import com.navcaddy.core.events.ConversationAnalytics;
import com.navcaddy.core.events.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Streams one session's analytics events to a client as server-sent events.
 * <p>
 * Each emitter holds a session subscription on the {@link EventBus}. The stream ends by itself
 * when the session ends; timeouts, client disconnects and errors drop the subscription too.
 */
@Service
public class SessionEventStream {

    private static final Logger log = LoggerFactory.getLogger(SessionEventStream.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<Registration> active = new CopyOnWriteArrayList<>();

    @Autowired
    public SessionEventStream(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SessionEventStream(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Opens a stream of the session's events. The caller checks that the session exists.
     */
    public SseEmitter open(String sessionId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var registration = new Registration(sessionId, emitter);
        registration.subscription = eventBus.subscribe(sessionId, event -> forward(registration, event));
        active.add(registration);

        emitter.onCompletion(() -> close(registration));
        emitter.onTimeout(() -> {
            log.debug("Event stream for session {} timed out", sessionId);
            close(registration);
        });
        emitter.onError(ex -> {
            log.debug("Event stream for session {} failed: {}", sessionId, ex.getMessage());
            close(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Could not open event stream for session {}: {}", sessionId, e.getMessage());
        }
        log.info("Event stream opened for session {}", sessionId);
        return emitter;
    }

    public int activeStreamCount() {
        return active.size();
    }

    private void forward(Registration registration, AnalyticsEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", event.sessionId());
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            registration.emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropped {} for session {}: {}", event.eventType(), event.sessionId(), e.getMessage());
        }

        if (ConversationAnalytics.SESSION_ENDED.equals(event.eventType())) {
            close(registration);
            registration.emitter.complete();
        }
    }

    private void close(Registration registration) {
        EventBus.Subscription subscription = registration.subscription;
        if (active.remove(registration) && subscription != null) {
            subscription.unsubscribe();
            log.debug("Event stream closed for session {}", registration.sessionId);
        }
    }

    private static final class Registration {
        final String sessionId;
        final SseEmitter emitter;
        volatile EventBus.Subscription subscription;

        Registration(String sessionId, SseEmitter emitter) {
            this.sessionId = sessionId;
            this.emitter = emitter;
        }
    }
}
