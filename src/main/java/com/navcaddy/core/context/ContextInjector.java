package com.navcaddy.core.context;

import com.navcaddy.core.model.ConversationTurn;
import com.navcaddy.core.model.CourseConditions;
import com.navcaddy.core.model.RoundState;
import com.navcaddy.core.model.SessionContext;
import com.navcaddy.core.model.Shot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link SessionContext} as text for model requests and UI summaries.
 */
@Component
public class ContextInjector {

    static final String NO_ACTIVE_SESSION = "No active session";

    /**
     * Builds the labelled context block sent alongside an utterance. Sections without data are omitted
     * and an empty context renders as an empty string.
     */
    public String buildPrompt(SessionContext context) {
        if (context == null || context.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        sb.append("## Current Context\n\n");

        RoundState round = context.currentRound();
        if (round != null) {
            sb.append("**Round Information:**\n");
            sb.append("- Course: ").append(round.courseName()).append('\n');
            sb.append("- Round ID: ").append(round.roundId()).append('\n');
            if (round.conditions() != null) {
                sb.append("- Conditions: ").append(describe(round.conditions())).append('\n');
            }
            sb.append('\n');
        }

        if (context.currentHole() != null) {
            sb.append("**Current Position:**\n");
            sb.append("- Hole: ").append(context.currentHole()).append('\n');
            if (round != null) {
                sb.append("- Par: ").append(round.currentPar()).append('\n');
                if (round.holesCompleted() > 0) {
                    sb.append("- Score: ").append(round.totalScore())
                            .append(" through ").append(round.holesCompleted()).append(" holes\n");
                }
            }
            sb.append('\n');
        }

        Shot shot = context.lastShot();
        if (shot != null) {
            sb.append("**Last Shot:**\n");
            sb.append("- Club: ").append(shot.club().name()).append('\n');
            if (shot.missDirection() != null) {
                sb.append("- Miss: ").append(shot.missDirection()).append('\n');
            }
            if (shot.lie() != null) {
                sb.append("- Lie: ").append(shot.lie()).append('\n');
            }
            if (shot.pressureContext().hasPressure()) {
                sb.append("- Pressure: yes");
                if (shot.pressureContext().scoringContext() != null) {
                    sb.append(" (").append(shot.pressureContext().scoringContext()).append(')');
                }
                sb.append('\n');
            }
            if (shot.notes() != null && !shot.notes().isBlank()) {
                sb.append("- Notes: ").append(shot.notes()).append('\n');
            }
            sb.append('\n');
        }

        if (context.lastRecommendation() != null) {
            sb.append("**Last Recommendation:**\n");
            sb.append(context.lastRecommendation()).append("\n\n");
        }

        List<ConversationTurn> history = context.conversationHistory();
        if (!history.isEmpty()) {
            sb.append("**Recent Conversation:**\n");
            int from = Math.max(0, history.size() - SessionContext.MAX_HISTORY_SIZE);
            for (ConversationTurn turn : history.subList(from, history.size())) {
                sb.append("- ").append(roleLabel(turn.role())).append(": ").append(turn.content()).append('\n');
            }
        }
        return sb.toString().trim();
    }

    /**
     * One-line summary for headers, e.g. "Pebble Beach • Hole 7 • Last: 7-Iron".
     */
    public String buildSummary(SessionContext context) {
        if (context == null) {
            return NO_ACTIVE_SESSION;
        }
        var parts = new ArrayList<String>();
        if (context.currentRound() != null) {
            parts.add(context.currentRound().courseName());
        }
        if (context.currentHole() != null) {
            parts.add("Hole " + context.currentHole());
        }
        if (context.lastShot() != null) {
            parts.add("Last: " + context.lastShot().club().name());
        }
        return parts.isEmpty() ? NO_ACTIVE_SESSION : String.join(" • ", parts);
    }

    /**
     * Only the latest user/assistant exchange, or an empty string if either side is missing.
     */
    public String buildFollowUpContext(SessionContext context) {
        if (context == null) {
            return "";
        }
        String lastUser = lastContent(context.conversationHistory(), ConversationTurn.Role.USER);
        String lastAssistant = lastContent(context.conversationHistory(), ConversationTurn.Role.ASSISTANT);
        if (lastUser == null || lastAssistant == null) {
            return "";
        }
        return "Last exchange:\nUser: " + lastUser + "\nAssistant: " + lastAssistant;
    }

    /**
     * Flat key/value hints for callers that want structured context instead of prose.
     */
    public Map<String, String> extractContextHints(SessionContext context) {
        Map<String, String> hints = new LinkedHashMap<>();
        if (context == null) {
            hints.put("hasActiveRound", "false");
            return hints;
        }
        hints.put("hasActiveRound", String.valueOf(context.hasActiveRound()));
        if (context.currentRound() != null) {
            hints.put("course", context.currentRound().courseName());
        }
        if (context.currentHole() != null) {
            hints.put("currentHole", String.valueOf(context.currentHole()));
        }
        if (context.lastShot() != null) {
            hints.put("lastClub", context.lastShot().club().name());
            if (context.lastShot().missDirection() != null) {
                hints.put("lastMiss", context.lastShot().missDirection().name());
            }
        }
        if (context.lastRecommendation() != null) {
            hints.put("lastRecommendation", context.lastRecommendation());
        }
        hints.put("conversationTurns", String.valueOf(context.conversationHistory().size()));
        return hints;
    }

    private static String lastContent(List<ConversationTurn> history, ConversationTurn.Role role) {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).role() == role) {
                return history.get(i).content();
            }
        }
        return null;
    }

    private static String roleLabel(ConversationTurn.Role role) {
        return switch (role) {
            case USER -> "User";
            case ASSISTANT -> "Assistant";
        };
    }

    private static String describe(CourseConditions conditions) {
        var parts = new ArrayList<String>();
        if (conditions.weather() != null) {
            parts.add(conditions.weather());
        }
        if (conditions.windSpeed() != null) {
            String wind = "wind " + conditions.windSpeed() + " mph";
            if (conditions.windDirection() != null) {
                wind += " " + conditions.windDirection();
            }
            parts.add(wind);
        }
        if (conditions.temperature() != null) {
            parts.add(conditions.temperature() + "F");
        }
        return parts.isEmpty() ? "unknown" : String.join(", ", parts);
    }
}
