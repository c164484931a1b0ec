package com.navcaddy.core.intent;

import com.navcaddy.core.model.ExtractedEntities;
import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.Module;
import com.navcaddy.core.model.RoutingTarget;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Catalog of every supported intent with its routing target and example phrases.
 */
public final class IntentRegistry {

    private static final Map<IntentType, IntentSchema> SCHEMAS = new EnumMap<>(IntentType.class);

    static {
        register(new IntentSchema(IntentType.CLUB_ADJUSTMENT, "Club Adjustment",
                "Adjust club distances or yardage expectations", "Adjust Club",
                Set.of(EntityType.CLUB), Set.of(EntityType.YARDAGE),
                List.of("My 7-iron feels long today",
                        "I need to adjust my driver distance",
                        "Update my pitching wedge to 120 yards",
                        "Change 5-iron yardage",
                        "Recalibrate my 3-wood"),
                new RoutingTarget(Module.CADDY, "ClubAdjustmentScreen")));
        register(new IntentSchema(IntentType.RECOVERY_CHECK, "Recovery Check",
                "Check recovery status and readiness", "Check Recovery",
                Set.of(), Set.of(EntityType.FATIGUE, EntityType.PAIN),
                List.of("How's my recovery looking?",
                        "Am I ready to play today?",
                        "Check my recovery status",
                        "What's my readiness score?",
                        "How am I feeling today?"),
                new RoutingTarget(Module.RECOVERY, "RecoveryOverviewScreen")));
        register(new IntentSchema(IntentType.SHOT_RECOMMENDATION, "Shot Recommendation",
                "Get shot advice based on current situation", "Get Shot Advice",
                Set.of(), Set.of(EntityType.CLUB, EntityType.YARDAGE, EntityType.LIE, EntityType.WIND),
                List.of("What club should I hit?",
                        "150 yards into the wind, what's the play?",
                        "Big tee shot, what should I do?",
                        "Recommend a shot from the rough",
                        "Help me with this approach shot"),
                new RoutingTarget(Module.CADDY, "LiveCaddyScreen", Map.of("expandStrategy", "true"))));
        register(new IntentSchema(IntentType.SCORE_ENTRY, "Score Entry",
                "Enter or update score for a hole", "Enter Score",
                Set.of(), Set.of(EntityType.HOLE_NUMBER, EntityType.SCORE_CONTEXT),
                List.of("I got a birdie on this hole",
                        "Mark down a par",
                        "Enter score for hole 7",
                        "I made a 5 on the last hole",
                        "Update my score"),
                new RoutingTarget(Module.CADDY, "ScoreEntryScreen")));
        register(new IntentSchema(IntentType.PATTERN_QUERY, "Pattern Query",
                "Ask about historical miss patterns or tendencies", "View Patterns",
                Set.of(), Set.of(EntityType.CLUB, EntityType.LIE),
                List.of("What are my miss patterns with 7-iron?",
                        "Do I slice when I'm under pressure?",
                        "Show my tendencies off the tee",
                        "What's my common miss with wedges?",
                        "Am I pushing my irons lately?"),
                null));
        register(new IntentSchema(IntentType.DRILL_REQUEST, "Drill Request",
                "Request a practice drill or training exercise", "Get Drill",
                Set.of(), Set.of(EntityType.CLUB, EntityType.DRILL_TYPE),
                List.of("Give me a drill for my slice",
                        "I need putting practice",
                        "What drill can fix my push?",
                        "Recommend a chipping drill",
                        "Show me some driver drills"),
                new RoutingTarget(Module.COACH, "DrillScreen")));
        register(new IntentSchema(IntentType.WEATHER_CHECK, "Weather Check",
                "Check current or forecast weather conditions", "Check Weather",
                Set.of(), Set.of(),
                List.of("What's the weather looking like?",
                        "How's the wind today?",
                        "Check the forecast",
                        "Is it going to rain?",
                        "Show me the weather"),
                new RoutingTarget(Module.CADDY, "LiveCaddyScreen", Map.of("expandWeather", "true"))));
        register(new IntentSchema(IntentType.STATS_LOOKUP, "Stats Lookup",
                "Look up statistics and performance data", "View Stats",
                Set.of(), Set.of(EntityType.STAT_TYPE, EntityType.CLUB),
                List.of("Show my stats",
                        "What's my average score?",
                        "How am I doing with my driver?",
                        "Show my fairways hit percentage",
                        "What are my putting stats?"),
                new RoutingTarget(Module.CADDY, "StatsScreen")));
        register(new IntentSchema(IntentType.ROUND_START, "Round Start",
                "Start a new round of golf", "Start Round",
                Set.of(), Set.of(EntityType.COURSE_NAME),
                List.of("Start a new round",
                        "I'm playing at Pebble Beach today",
                        "Begin round",
                        "Let's tee off",
                        "Starting a round at my home course"),
                new RoutingTarget(Module.CADDY, "RoundSetupScreen")));
        register(new IntentSchema(IntentType.ROUND_END, "Round End",
                "End the current round and view summary", "End Round",
                Set.of(), Set.of(),
                List.of("Finish this round",
                        "End round",
                        "I'm done playing",
                        "Show me the round summary",
                        "Complete this round"),
                new RoutingTarget(Module.CADDY, "RoundSummaryScreen")));
        register(new IntentSchema(IntentType.EQUIPMENT_INFO, "Equipment Info",
                "Get information about equipment and bag contents", "View Equipment",
                Set.of(), Set.of(EntityType.EQUIPMENT_TYPE, EntityType.CLUB),
                List.of("What's in my bag?",
                        "Show my club specs",
                        "Tell me about my driver",
                        "What equipment am I using?",
                        "Show my club distances"),
                new RoutingTarget(Module.SETTINGS, "EquipmentScreen")));
        register(new IntentSchema(IntentType.COURSE_INFO, "Course Info",
                "Get course information and hole details", "Course Info",
                Set.of(), Set.of(EntityType.COURSE_NAME, EntityType.HOLE_NUMBER),
                List.of("Tell me about this hole",
                        "What's the yardage on hole 7?",
                        "Show the course layout",
                        "Course information",
                        "What's the layout of this hole?"),
                new RoutingTarget(Module.CADDY, "CourseInfoScreen")));
        register(new IntentSchema(IntentType.SETTINGS_CHANGE, "Settings Change",
                "Change app settings or preferences", "Settings",
                Set.of(), Set.of(EntityType.SETTING_KEY),
                List.of("Change my settings",
                        "Update my preferences",
                        "Turn on notifications",
                        "Change units to metric",
                        "Open settings"),
                new RoutingTarget(Module.SETTINGS, "SettingsScreen")));
        register(new IntentSchema(IntentType.HELP_REQUEST, "Help Request",
                "Get help or instructions about the app", "Get Help",
                Set.of(), Set.of(),
                List.of("Help me",
                        "How do I use this?",
                        "What can you do?",
                        "I need help",
                        "Show me what you can do"),
                null));
        register(new IntentSchema(IntentType.FEEDBACK, "Feedback",
                "Provide feedback about the app", "Send Feedback",
                Set.of(), Set.of(EntityType.FEEDBACK_TEXT),
                List.of("I have feedback",
                        "Report a problem",
                        "Send feedback",
                        "I found a bug",
                        "Suggestion for improvement"),
                new RoutingTarget(Module.SETTINGS, "FeedbackScreen")));
    }

    private IntentRegistry() {}

    private static void register(IntentSchema schema) {
        SCHEMAS.put(schema.intentType(), schema);
    }

    public static IntentSchema getSchema(IntentType intentType) {
        IntentSchema schema = SCHEMAS.get(intentType);
        if (schema == null) {
            throw new IllegalStateException("No schema registered for " + intentType);
        }
        return schema;
    }

    /** All schemas in {@link IntentType} declaration order. */
    public static List<IntentSchema> getAllSchemas() {
        return List.copyOf(SCHEMAS.values());
    }

    public static List<IntentSchema> getSchemasForModule(Module module) {
        return SCHEMAS.values().stream()
                .filter(s -> s.navigates() && s.defaultRoutingTarget().module() == module)
                .toList();
    }

    /**
     * Builds the routing target for an intent, layering entity values over the schema's default
     * parameters. Returns {@code null} for intents that do not navigate.
     */
    public static RoutingTarget resolveTarget(IntentType intentType, ExtractedEntities entities) {
        RoutingTarget base = getSchema(intentType).defaultRoutingTarget();
        if (base == null) {
            return null;
        }
        if (entities == null || entities.isEmpty()) {
            return base;
        }
        Map<String, String> parameters = new LinkedHashMap<>(base.parameters());
        if (entities.club() != null) {
            parameters.put("club", entities.club().name());
        }
        if (entities.yardage() != null) {
            parameters.put("yardage", String.valueOf(entities.yardage()));
        }
        if (entities.lie() != null) {
            parameters.put("lie", entities.lie().name());
        }
        if (entities.holeNumber() != null) {
            parameters.put("holeNumber", String.valueOf(entities.holeNumber()));
        }
        return new RoutingTarget(base.module(), base.screen(), parameters);
    }
}
