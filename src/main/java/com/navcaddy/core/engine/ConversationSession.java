package com.navcaddy.core.engine;

import com.navcaddy.core.classifier.CancellationToken;
import com.navcaddy.core.context.SessionContextStore;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One user's conversation: its context store and the turn currently in flight.
 * <p>
 * At most one turn is live at a time. Starting a turn cancels the previous one, and a turn only
 * writes to the store while it is still the live one, so the newest input always wins.
 */
public class ConversationSession {

    private final String id;
    private final SessionContextStore store;
    private final Instant createdAt;
    private final AtomicLong turnCounter = new AtomicLong();
    private final Object turnLock = new Object();

    private CancellationToken liveTurn;

    ConversationSession(String id, SessionContextStore store, Instant createdAt) {
        this.id = id;
        this.store = store;
        this.createdAt = createdAt;
    }

    public String id() {
        return id;
    }

    public SessionContextStore store() {
        return store;
    }

    public Instant createdAt() {
        return createdAt;
    }

    String nextTurnId() {
        return id + "-" + turnCounter.incrementAndGet();
    }

    /**
     * Makes {@code token} the live turn.
     *
     * @return {@code true} if an unfinished earlier turn was cancelled
     */
    boolean beginTurn(CancellationToken token) {
        synchronized (turnLock) {
            CancellationToken previous = liveTurn;
            liveTurn = token;
            if (previous != null && !previous.isCancelled()) {
                previous.cancel();
                return true;
            }
            return false;
        }
    }

    void finishTurn(CancellationToken token) {
        synchronized (turnLock) {
            if (liveTurn == token) {
                liveTurn = null;
            }
        }
    }

    /**
     * Runs {@code update} against the store if {@code token} has not been superseded.
     *
     * @throws com.navcaddy.core.classifier.ClassificationCancelledException if it has
     */
    void commit(CancellationToken token, Runnable update) {
        synchronized (turnLock) {
            token.throwIfCancelled();
            update.run();
        }
    }

    /** Cancels whatever turn is in flight, used when the session ends. */
    void cancelLiveTurn() {
        synchronized (turnLock) {
            if (liveTurn != null) {
                liveTurn.cancel();
                liveTurn = null;
            }
        }
    }
}
