package com.navcaddy.core.offline;

import com.navcaddy.core.clarification.ClarificationGenerator;
import com.navcaddy.core.classifier.ConfidenceRouter;
import com.navcaddy.core.error.ErrorKind;
import com.navcaddy.core.model.ClassificationResult;
import com.navcaddy.core.model.Club;
import com.navcaddy.core.model.ClubParser;
import com.navcaddy.core.model.ExtractedEntities;
import com.navcaddy.core.model.IntentSuggestion;
import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.ParsedIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies an utterance with weighted keywords when the language model cannot be reached.
 * <p>
 * A clear match on an offline intent is routed like a confident model answer. Weaker or tied
 * matches become a clarification limited to offline intents. Input that points at an intent needing
 * the network, or at nothing at all, ends in a recoverable network error explaining what still works.
 */
@Component
public class OfflineIntentMatcher {

    private static final Logger log = LoggerFactory.getLogger(OfflineIntentMatcher.class);

    static final double STRONG_MATCH = 0.75;
    private static final double EXTRA_KEYWORD_BONUS = 0.1;

    private record Keyword(Pattern pattern, double weight) {}

    private static final Map<IntentType, List<Keyword>> KEYWORDS = new EnumMap<>(IntentType.class);

    static {
        keywords(IntentType.SCORE_ENTRY, "score", 1.0, "enter", 0.8, "record", 0.8, "par", 0.6,
                "birdie", 0.6, "bogey", 0.6, "hole", 0.5);
        keywords(IntentType.STATS_LOOKUP, "stats", 1.0, "statistics", 1.0, "performance", 0.8,
                "average", 0.7, "handicap", 0.7, "summary", 0.6);
        keywords(IntentType.EQUIPMENT_INFO, "equipment", 1.0, "my bag", 0.9, "bag", 0.8, "clubs", 0.8,
                "what's in", 0.7);
        keywords(IntentType.ROUND_START, "new round", 1.0, "start", 0.9, "tee off", 0.9, "begin", 0.8,
                "first hole", 0.7);
        keywords(IntentType.ROUND_END, "end", 0.9, "finish", 0.9, "complete", 0.8, "last hole", 0.8,
                "done", 0.7);
        keywords(IntentType.SETTINGS_CHANGE, "settings", 1.0, "preferences", 0.9, "options", 0.8,
                "configure", 0.8, "setup", 0.7);
        keywords(IntentType.HELP_REQUEST, "help", 1.0, "how to", 0.9, "instructions", 0.8, "guide", 0.7,
                "tutorial", 0.7);
        keywords(IntentType.CLUB_ADJUSTMENT, "adjust", 0.9, "club", 0.8, "distance", 0.8, "yardage", 0.8,
                "change", 0.7);
        keywords(IntentType.PATTERN_QUERY, "pattern", 1.0, "miss", 0.9, "tendency", 0.9, "tendencies", 0.9,
                "slice", 0.7, "hook", 0.7);
        keywords(IntentType.SHOT_RECOMMENDATION, "what club", 1.0, "which club", 1.0, "recommend", 1.0,
                "advice", 0.9, "shot", 0.9);
        keywords(IntentType.RECOVERY_CHECK, "recovery", 1.0, "readiness", 0.9, "sore", 0.8, "tired", 0.7);
        keywords(IntentType.DRILL_REQUEST, "drill", 1.0, "practice", 0.9, "exercise", 0.8, "training", 0.8);
        keywords(IntentType.WEATHER_CHECK, "weather", 1.0, "forecast", 0.9, "wind", 0.9, "rain", 0.8);
        keywords(IntentType.COURSE_INFO, "course", 1.0, "layout", 0.9, "map", 0.8, "hole", 0.6);
        keywords(IntentType.FEEDBACK, "feedback", 1.0, "bug", 0.8, "report", 0.8, "suggestion", 0.8);
    }

    private static final Pattern CLUB = Pattern.compile(
            "\\b(\\d-(?:iron|wood|hybrid)|driver|putter|(?:pitching|gap|approach|sand|lob) wedge)\\b");
    private static final Pattern HOLE = Pattern.compile("\\bhole (\\d{1,2})\\b");
    private static final Pattern YARDAGE = Pattern.compile("(?<![\\d-])(\\d{2,3})(?![\\d-])");
    private static final Pattern SCORE_WORD = Pattern.compile("\\b(eagle|birdie|double bogey|bogey|par)\\b");

    private final ConfidenceRouter router;

    public OfflineIntentMatcher(ConfidenceRouter router) {
        this.router = router;
    }

    /**
     * @param normalizedInput input after normalization
     * @param originalInput   input as the user gave it, echoed back in clarifications
     */
    public ClassificationResult match(String normalizedInput, String originalInput) {
        String text = normalizedInput == null ? "" : normalizedInput.toLowerCase(Locale.ROOT);
        List<Score> scores = score(text);
        if (scores.isEmpty()) {
            log.info("Offline match found nothing");
            return networkError(OfflineCapability.NO_MATCH_MESSAGE);
        }

        Score best = scores.get(0);
        if (!OfflineCapability.isOfflineAvailable(best.intentType())) {
            log.info("Offline match points at online-only intent {}", best.intentType());
            return networkError(OfflineCapability.limitationMessage(best.intentType()));
        }

        List<Score> offline = scores.stream()
                .filter(s -> OfflineCapability.isOfflineAvailable(s.intentType()))
                .toList();
        boolean clearWinner = offline.size() == 1 || offline.get(1).value() < best.value();
        if (best.value() >= STRONG_MATCH && clearWinner) {
            log.info("Offline match {} ({})", best.intentType(), String.format(Locale.ROOT, "%.2f", best.value()));
            var intent = new ParsedIntent(best.intentType(), best.value(),
                    entities(text, best.intentType()), null, null);
            return router.route(intent, text, originalInput);
        }

        List<IntentSuggestion> suggestions = offline.stream()
                .limit(ClassificationResult.MAX_SUGGESTIONS)
                .map(s -> ClarificationGenerator.toSuggestion(s.intentType()))
                .toList();
        log.info("Offline match ambiguous, offering {} suggestion(s)", suggestions.size());
        return new ClassificationResult.Clarify(originalInput, OfflineCapability.CLARIFY_MESSAGE, suggestions);
    }

    /** Every intent with at least one keyword hit, best first; ties keep {@link IntentType} order. */
    List<Score> score(String text) {
        var scores = new ArrayList<Score>();
        for (var entry : KEYWORDS.entrySet()) {
            double top = 0;
            int hits = 0;
            for (Keyword keyword : entry.getValue()) {
                if (keyword.pattern().matcher(text).find()) {
                    top = Math.max(top, keyword.weight());
                    hits++;
                }
            }
            if (hits > 0) {
                scores.add(new Score(entry.getKey(), Math.min(1.0, top + EXTRA_KEYWORD_BONUS * (hits - 1))));
            }
        }
        scores.sort(Comparator.comparingDouble(Score::value).reversed());
        return scores;
    }

    /** Only simple patterns can be pulled out without the model. */
    private static ExtractedEntities entities(String text, IntentType intentType) {
        return switch (intentType) {
            case SCORE_ENTRY -> new ExtractedEntities(null, null, null, null, null, null,
                    group(SCORE_WORD, text), hole(text));
            case CLUB_ADJUSTMENT -> new ExtractedEntities(club(text), yardage(text), null, null, null, null, null, null);
            case EQUIPMENT_INFO -> new ExtractedEntities(club(text), null, null, null, null, null, null, null);
            default -> ExtractedEntities.empty();
        };
    }

    private static Club club(String text) {
        return ClubParser.parse(group(CLUB, text));
    }

    private static Integer hole(String text) {
        String hole = group(HOLE, text);
        return hole == null ? null : Integer.valueOf(hole);
    }

    private static Integer yardage(String text) {
        Matcher matcher = YARDAGE.matcher(text);
        while (matcher.find()) {
            int value = Integer.parseInt(matcher.group(1));
            if (value >= 50) {
                return value;
            }
        }
        return null;
    }

    private static String group(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static ClassificationResult networkError(String message) {
        return new ClassificationResult.Error(message, ErrorKind.CLASSIFICATION_NETWORK_FAILURE, true);
    }

    // keywords match at a word start, so "score" also covers "scores"
    private static void keywords(IntentType intentType, Object... pairs) {
        var list = new ArrayList<Keyword>();
        for (int i = 0; i < pairs.length; i += 2) {
            Pattern pattern = Pattern.compile("(?<![a-z0-9'])" + Pattern.quote((String) pairs[i]));
            list.add(new Keyword(pattern, (Double) pairs[i + 1]));
        }
        KEYWORDS.put(intentType, List.copyOf(list));
    }

    record Score(IntentType intentType, double value) {}
}
