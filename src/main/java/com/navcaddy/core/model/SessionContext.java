package com.navcaddy.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Immutable snapshot of a conversation session, used to disambiguate follow-up utterances.
 *
 * @param currentRound        active round, or {@code null}
 * @param currentHole         hole being played, 1..18, or {@code null}
 * @param lastShot            most recent recorded shot, or {@code null}
 * @param lastRecommendation  most recent assistant recommendation, or {@code null}
 * @param conversationHistory turns oldest first, at most {@link #MAX_HISTORY_SIZE}
 */
public record SessionContext(
    RoundState currentRound,
    Integer currentHole,
    Shot lastShot,
    String lastRecommendation,
    List<ConversationTurn> conversationHistory
) implements Serializable {

    public static final int MAX_HISTORY_SIZE = 10;

    private static final SessionContext EMPTY = new SessionContext(null, null, null, null, List.of());

    public SessionContext {
        if (currentHole != null && (currentHole < 1 || currentHole > 18)) {
            throw new IllegalArgumentException("currentHole must be within 1..18 but was " + currentHole);
        }
        conversationHistory = conversationHistory == null ? List.of() : List.copyOf(conversationHistory);
        if (conversationHistory.size() > MAX_HISTORY_SIZE) {
            throw new IllegalArgumentException("history holds at most " + MAX_HISTORY_SIZE + " turns");
        }
    }

    public static SessionContext empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return currentRound == null && currentHole == null && lastShot == null
                && lastRecommendation == null && conversationHistory.isEmpty();
    }

    public boolean hasActiveRound() {
        return currentRound != null;
    }
}
