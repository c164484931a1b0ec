package com.navcaddy.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing NavCaddy MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String TURN_ID = "turnId";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setTurn(String sessionId, String turnId) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(TURN_ID, turnId);
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(TURN_ID);
    }
}
