package com.navcaddy.core.model;

/**
 * The fixed set of goals a user utterance can be classified into.
 */
public enum IntentType {
    CLUB_ADJUSTMENT,
    RECOVERY_CHECK,
    SHOT_RECOMMENDATION,
    SCORE_ENTRY,
    PATTERN_QUERY,
    DRILL_REQUEST,
    WEATHER_CHECK,
    STATS_LOOKUP,
    ROUND_START,
    ROUND_END,
    EQUIPMENT_INFO,
    COURSE_INFO,
    SETTINGS_CHANGE,
    HELP_REQUEST,
    FEEDBACK
}
