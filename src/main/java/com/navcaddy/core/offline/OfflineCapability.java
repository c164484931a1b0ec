package com.navcaddy.core.offline;

import com.navcaddy.core.model.IntentType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which intents can still be served when the language model is unreachable.
 * <p>
 * Offline intents only touch local state or static screens; the rest need the model or
 * another remote service.
 */
public final class OfflineCapability {

    public static final Set<IntentType> OFFLINE_AVAILABLE = Set.copyOf(EnumSet.of(
            IntentType.SCORE_ENTRY,
            IntentType.STATS_LOOKUP,
            IntentType.EQUIPMENT_INFO,
            IntentType.ROUND_START,
            IntentType.ROUND_END,
            IntentType.SETTINGS_CHANGE,
            IntentType.HELP_REQUEST,
            IntentType.CLUB_ADJUSTMENT,
            IntentType.PATTERN_QUERY));

    public static final String OFFLINE_MODE_MESSAGE =
            "You're offline. I can help with scores, stats, equipment, and settings. "
                    + "Full features will be back when you reconnect.";

    public static final String NO_MATCH_MESSAGE = "I'm offline and didn't understand that. " + OFFLINE_MODE_MESSAGE;

    public static final String CLARIFY_MESSAGE = "I'm offline and need a bit more clarity. Did you mean one of these?";

    private OfflineCapability() {}

    public static boolean isOfflineAvailable(IntentType intentType) {
        return OFFLINE_AVAILABLE.contains(intentType);
    }

    public static String limitationMessage(IntentType intentType) {
        return switch (intentType) {
            case SHOT_RECOMMENDATION ->
                    "Shot recommendations need an internet connection. Try checking your stats or equipment instead.";
            case RECOVERY_CHECK -> "Recovery insights need an internet connection. Check back when you're online.";
            case DRILL_REQUEST ->
                    "Personalized drills need an internet connection. Check your patterns in the meantime.";
            case WEATHER_CHECK -> "Weather data needs an internet connection. I can't check conditions offline.";
            case COURSE_INFO ->
                    "Course information needs an internet connection. Try looking at your saved rounds instead.";
            case FEEDBACK -> "Feedback needs an internet connection. Send it again once you're back online.";
            default -> "This feature needs an internet connection. "
                    + "You can still enter scores, check stats, or view your equipment.";
        };
    }
}
