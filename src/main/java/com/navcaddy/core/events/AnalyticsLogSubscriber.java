package com.navcaddy.core.events;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Global subscriber that writes every analytics event to the log at DEBUG.
 */
@Component
public class AnalyticsLogSubscriber {

    private static final Logger log = LoggerFactory.getLogger("navcaddy.analytics");

    private final EventBus eventBus;
    private EventBus.Subscription subscription;

    public AnalyticsLogSubscriber(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @PostConstruct
    void start() {
        subscription = eventBus.subscribeAll(this::log);
    }

    @PreDestroy
    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    void log(AnalyticsEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("{} session={} {}", event.eventType(), event.sessionId(), event.payload());
        }
    }
}
