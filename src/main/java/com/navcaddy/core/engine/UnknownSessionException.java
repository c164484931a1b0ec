package com.navcaddy.core.engine;

/**
 * Thrown when a caller refers to a session that was never started or has already ended.
 */
public class UnknownSessionException extends RuntimeException {

    private final String sessionId;

    public UnknownSessionException(String sessionId) {
        super("Unknown session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
