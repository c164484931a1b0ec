package com.navcaddy.core.clarification;

import com.navcaddy.core.intent.IntentRegistry;
import com.navcaddy.core.intent.IntentSchema;
import com.navcaddy.core.model.ClassificationResult;
import com.navcaddy.core.model.ConfidenceThresholds;
import com.navcaddy.core.model.IntentSuggestion;
import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.ParsedIntent;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds a clarification question when classification confidence is too low to act on.
 * <p>
 * Suggestions are ranked: the model's own guess (when at least 0.30 confident), then the first
 * matching group of the cue table. Input that hits no cue is matched against registry example
 * phrases before falling back to general-purpose intents. At most three are returned.
 */
@Component
public class ClarificationGenerator {

    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9']+");

    /** Lexical cue groups in priority order; the first group with a hit wins. */
    private record CueGroup(String name, List<String> cues, List<IntentType> intents) {}

    private static final List<CueGroup> CUE_TABLE = List.of(
            new CueGroup("physical", List.of("feel", "pain", "sore", "tired", "ready", "hurt"),
                    List.of(IntentType.RECOVERY_CHECK, IntentType.PATTERN_QUERY, IntentType.STATS_LOOKUP)),
            new CueGroup("problem", List.of("off", "wrong", "bad", "problem", "issue", "fix"),
                    List.of(IntentType.CLUB_ADJUSTMENT, IntentType.PATTERN_QUERY, IntentType.DRILL_REQUEST)),
            new CueGroup("advice", List.of("what", "should", "help", "advice", "recommend"),
                    List.of(IntentType.SHOT_RECOMMENDATION, IntentType.HELP_REQUEST, IntentType.DRILL_REQUEST)),
            new CueGroup("equipment", List.of("club", "bag", "equipment", "distance", "yardage"),
                    List.of(IntentType.CLUB_ADJUSTMENT, IntentType.EQUIPMENT_INFO, IntentType.STATS_LOOKUP)),
            new CueGroup("scoring", List.of("score", "round", "play", "game", "hole"),
                    List.of(IntentType.SCORE_ENTRY, IntentType.ROUND_START, IntentType.STATS_LOOKUP))
    );

    private static final List<IntentType> DEFAULT_INTENTS =
            List.of(IntentType.SHOT_RECOMMENDATION, IntentType.HELP_REQUEST, IntentType.STATS_LOOKUP);

    static final String SHORT_INPUT_MESSAGE = "I'm not sure what you need. Did you mean one of these?";
    static final String FEEL_MESSAGE = "I'm not sure what you're referring to. Which of these are you looking for?";
    static final String PROBLEM_MESSAGE = "Could you clarify what's off? Which of these are you looking for?";
    static final String HELP_MESSAGE = "I can help with that. Which of these would you like to do?";
    static final String DEFAULT_MESSAGE = "I'm not sure what you're asking. Did you mean one of these?";

    public ClarificationResponse generate(String input, ParsedIntent parsedIntent) {
        List<String> words = tokenize(input);
        var ranked = new LinkedHashSet<IntentType>();

        if (parsedIntent != null && parsedIntent.confidence() >= ConfidenceThresholds.CLARIFY_SUGGESTION_FLOOR) {
            ranked.add(parsedIntent.intentType());
        }

        CueGroup group = firstMatchingGroup(words);
        if (group != null) {
            ranked.addAll(group.intents());
        } else {
            ranked.addAll(examplePhraseMatches(words));
            ranked.addAll(DEFAULT_INTENTS);
        }

        List<IntentSuggestion> suggestions = ranked.stream()
                .limit(ClassificationResult.MAX_SUGGESTIONS)
                .map(ClarificationGenerator::toSuggestion)
                .toList();
        return new ClarificationResponse(messageFor(words), suggestions, input == null ? "" : input);
    }

    public static IntentSuggestion toSuggestion(IntentType intentType) {
        IntentSchema schema = IntentRegistry.getSchema(intentType);
        return new IntentSuggestion(intentType, schema.suggestionLabel(), schema.description());
    }

    private static String messageFor(List<String> words) {
        if (words.size() <= 3) {
            return SHORT_INPUT_MESSAGE;
        }
        if (containsAny(words, "feel")) {
            return FEEL_MESSAGE;
        }
        if (containsAny(words, "off", "wrong", "problem")) {
            return PROBLEM_MESSAGE;
        }
        if (containsAny(words, "help", "what", "how")) {
            return HELP_MESSAGE;
        }
        return DEFAULT_MESSAGE;
    }

    private static CueGroup firstMatchingGroup(List<String> words) {
        for (CueGroup group : CUE_TABLE) {
            if (containsAny(words, group.cues().toArray(String[]::new))) {
                return group;
            }
        }
        return null;
    }

    /**
     * Intents whose example phrases share meaningful words (longer than three letters) with the input,
     * best overlap first.
     */
    private static List<IntentType> examplePhraseMatches(List<String> words) {
        Set<String> inputWords = new LinkedHashSet<>(words);
        Map<IntentType, Integer> scores = new HashMap<>();
        for (IntentSchema schema : IntentRegistry.getAllSchemas()) {
            int score = 0;
            for (String phrase : schema.examplePhrases()) {
                for (String word : tokenize(phrase)) {
                    if (word.length() > 3 && inputWords.contains(word)) {
                        score++;
                    }
                }
            }
            if (score > 0) {
                scores.put(schema.intentType(), score);
            }
        }
        return scores.entrySet().stream()
                .sorted(Map.Entry.<IntentType, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .toList();
    }

    // cue "feel" matches "feels" and "feeling"
    private static boolean containsAny(List<String> words, String... cues) {
        for (String word : words) {
            for (String cue : cues) {
                if (word.startsWith(cue)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
                .filter(w -> !w.isEmpty())
                .toList();
    }
}
