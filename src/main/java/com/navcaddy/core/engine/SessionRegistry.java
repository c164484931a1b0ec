package com.navcaddy.core.engine;

import com.navcaddy.core.context.SessionContextStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live conversation sessions, keyed by id.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final SessionProperties properties;
    private final Clock clock;

    public SessionRegistry(SessionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public ConversationSession create() {
        String id = UUID.randomUUID().toString();
        var session = new ConversationSession(id,
                new SessionContextStore(clock, properties.getMaxHistory()), clock.instant());
        sessions.put(id, session);
        log.info("Session {} created ({} active)", id, sessions.size());
        return session;
    }

    public Optional<ConversationSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    public ConversationSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new UnknownSessionException(sessionId));
    }

    public Optional<ConversationSession> remove(String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public int activeCount() {
        return sessions.size();
    }
}
