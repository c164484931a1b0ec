package com.navcaddy.core.context;

import com.navcaddy.core.model.ConversationTurn;
import com.navcaddy.core.model.CourseConditions;
import com.navcaddy.core.model.RoundState;
import com.navcaddy.core.model.SessionContext;
import com.navcaddy.core.model.Shot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Mutable conversation state for one round.
 * <p>
 * One store belongs to one conversation session. Mutations are serialized against each other;
 * {@link #snapshot()} may be called concurrently and always returns an immutable copy.
 * History is bounded to {@link SessionContext#MAX_HISTORY_SIZE} turns, evicting the oldest first.
 */
public class SessionContextStore {

    private static final Logger log = LoggerFactory.getLogger(SessionContextStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final int maxHistory;

    private RoundState round;
    private Integer currentHole;
    private Shot lastShot;
    private String lastRecommendation;
    private final Deque<ConversationTurn> history = new ArrayDeque<>();

    public SessionContextStore() {
        this(Clock.systemUTC(), SessionContext.MAX_HISTORY_SIZE);
    }

    public SessionContextStore(Clock clock, int maxHistory) {
        if (maxHistory < 1 || maxHistory > SessionContext.MAX_HISTORY_SIZE) {
            throw new IllegalArgumentException("maxHistory must be within 1.." + SessionContext.MAX_HISTORY_SIZE);
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxHistory = maxHistory;
    }

    /**
     * Appends a user utterance and the assistant's reply as two consecutive turns.
     */
    public void appendTurn(String userInput, String assistantResponse) {
        requireText(userInput, "userInput");
        requireText(assistantResponse, "assistantResponse");
        write(() -> {
            var now = clock.instant();
            push(ConversationTurn.user(userInput, now));
            push(ConversationTurn.assistant(assistantResponse, now));
        });
    }

    public void appendTurn(ConversationTurn turn) {
        Objects.requireNonNull(turn, "turn");
        write(() -> push(turn));
    }

    /**
     * Starts tracking a round. Replaces any previous round but keeps conversation history.
     */
    public void updateRound(String roundId, String courseName, int startingHole, int par) {
        requireText(roundId, "roundId");
        requireText(courseName, "courseName");
        requireHole(startingHole);
        requirePar(par);
        write(() -> {
            round = new RoundState(roundId, courseName, startingHole, par, 0, 0, null);
            currentHole = startingHole;
        });
        log.info("Round {} started at hole {}", roundId, startingHole);
    }

    public void updateRound(String roundId, String courseName) {
        updateRound(roundId, courseName, 1, 4);
    }

    public void updateHole(int hole, int par) {
        requireHole(hole);
        requirePar(par);
        write(() -> {
            currentHole = hole;
            if (round != null) {
                round = round.withHole(hole, par);
            }
        });
    }

    public void updateScore(int totalScore, int holesCompleted) {
        if (holesCompleted < 0 || holesCompleted > 18) {
            throw new IllegalArgumentException("holesCompleted must be within 0..18 but was " + holesCompleted);
        }
        write(() -> {
            if (round == null) {
                throw new IllegalStateException("No active round to score");
            }
            round = round.withScore(totalScore, holesCompleted);
        });
    }

    public void updateConditions(CourseConditions conditions) {
        write(() -> {
            if (round == null) {
                throw new IllegalStateException("No active round to update conditions for");
            }
            round = round.withConditions(conditions);
        });
    }

    public void recordShot(Shot shot) {
        Objects.requireNonNull(shot, "shot");
        write(() -> lastShot = shot);
    }

    public void recordRecommendation(String recommendation) {
        requireText(recommendation, "recommendation");
        write(() -> lastRecommendation = recommendation);
    }

    /** Drops all state; used at round end and on explicit reset. */
    public void clear() {
        write(() -> {
            round = null;
            currentHole = null;
            lastShot = null;
            lastRecommendation = null;
            history.clear();
        });
        log.debug("Session context cleared");
    }

    /** Drops conversation turns but keeps round state. */
    public void clearHistory() {
        write(history::clear);
    }

    public SessionContext snapshot() {
        lock.readLock().lock();
        try {
            return new SessionContext(round, currentHole, lastShot, lastRecommendation, new ArrayList<>(history));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasActiveRound() {
        lock.readLock().lock();
        try {
            return round != null;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void push(ConversationTurn turn) {
        history.addLast(turn);
        while (history.size() > maxHistory) {
            history.removeFirst();
        }
    }

    private void write(Runnable mutation) {
        lock.writeLock().lock();
        try {
            mutation.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static void requireHole(int hole) {
        if (hole < 1 || hole > 18) {
            throw new IllegalArgumentException("hole must be within 1..18 but was " + hole);
        }
    }

    private static void requirePar(int par) {
        if (par < 3 || par > 5) {
            throw new IllegalArgumentException("par must be within 3..5 but was " + par);
        }
    }
}
