package com.navcaddy.core.persona;

import com.navcaddy.core.metrics.NavCaddyMetrics;
import com.navcaddy.core.model.MissPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Post-processes generated text into the caddy's voice.
 * <p>
 * Steps, always in this order: guardrail scan of the raw text, filler removal, formal-to-natural
 * word swaps, guarantee softening, optional miss-pattern summary, then at most one disclaimer.
 * Pattern confidence decays with age (see {@link MissPattern#decayedConfidence}); apart from that
 * the output depends only on the inputs.
 */
@Component
public class ResponseFormatter {

    private static final Logger log = LoggerFactory.getLogger(ResponseFormatter.class);

    static final double PATTERN_CONFIDENCE_FLOOR = 0.6;
    static final int MAX_PATTERNS = 2;
    static final String PATTERN_HEADER = "**Based on your recent patterns:**";

    record Rewrite(Pattern pattern, String replacement) {

        static Rewrite of(String regex, String replacement) {
            return new Rewrite(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
        }

        static Rewrite literal(String phrase, String replacement) {
            return new Rewrite(Pattern.compile(Pattern.quote(phrase), Pattern.CASE_INSENSITIVE), replacement);
        }

        String apply(String text) {
            return pattern.matcher(text).replaceAll(replacement);
        }
    }

    static final List<Rewrite> FILLER = List.of(
            Rewrite.literal("As an AI assistant, ", ""),
            Rewrite.literal("As a language model, ", ""),
            Rewrite.literal("I'm here to help you ", ""),
            Rewrite.literal("Feel free to ask me ", ""),
            Rewrite.literal("Let me know if you need anything else", ""),
            Rewrite.literal("Is there anything else I can help you with?", "")
    );

    static final List<Rewrite> VOICE = List.of(
            Rewrite.of("\\butilize\\b", "use"),
            Rewrite.of("\\bapproximately\\b", "about"),
            Rewrite.of("\\bin order to\\b", "to"),
            Rewrite.of("\\bit is recommended that you\\b", "I'd recommend"),
            Rewrite.of("\\byou should consider\\b", "consider"),
            Rewrite.of("\\bit would be beneficial to\\b", "it'll help to")
    );

    static final List<Rewrite> SOFTENING = List.of(
            Rewrite.of("\\bthis will (fix|cure|eliminate|stop|prevent)\\b", "this may help with"),
            Rewrite.of("\\bwill (fix|cure|eliminate|stop|prevent)\\b", "may help with"),
            Rewrite.of("\\b(guaranteed|guarantee|definitely|certainly) (fix|improve|solve)\\b", "may help $2"),
            Rewrite.of("\\byou['\u2019]ll never\\b", "you'll be less likely to"),
            Rewrite.of("\\s*\\bguaranteed\\b", "")
    );

    private static final Pattern SPACE_RUNS = Pattern.compile("[ \\t]{2,}");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([.,!?;:])");

    private final PersonaGuardrails guardrails;
    private final NavCaddyMetrics metrics;
    private final Clock clock;

    public ResponseFormatter(PersonaGuardrails guardrails, NavCaddyMetrics metrics, Clock clock) {
        this.guardrails = guardrails;
        this.metrics = metrics;
        this.clock = clock;
    }

    public FormattedResponse format(String rawResponse, List<MissPattern> relevantPatterns, FormatOptions options) {
        String raw = rawResponse == null ? "" : rawResponse;
        FormatOptions opts = options == null ? FormatOptions.defaults() : options;

        GuardrailResult guardrail = guardrails.check(raw);

        String text = applyAll(FILLER, raw);
        text = applyAll(VOICE, text);
        text = applyAll(SOFTENING, text);
        text = tidy(text);

        int referenced = 0;
        if (opts.includePatterns() && relevantPatterns != null && !relevantPatterns.isEmpty()) {
            List<RankedPattern> top = strongest(relevantPatterns, clock.instant());
            if (!top.isEmpty()) {
                text = text + "\n\n" + summarise(top);
                referenced = top.size();
            }
        }

        DisclaimerType disclaimer = guardrail.needsDisclaimer()
                ? guardrail.disclaimerType()
                : opts.forcedDisclaimer();
        if (disclaimer != null) {
            text = text + disclaimer.block();
            metrics.recordDisclaimer(disclaimer.name().toLowerCase(Locale.ROOT));
            log.debug("Attached {} disclaimer ({})", disclaimer,
                    guardrail.needsDisclaimer() ? guardrail.violatedRule() : "forced by caller");
        }

        return new FormattedResponse(text, disclaimer != null, disclaimer, referenced);
    }

    public FormattedResponse format(String rawResponse) {
        return format(rawResponse, List.of(), FormatOptions.defaults());
    }

    /** A pattern with its confidence decayed to the formatting instant. */
    record RankedPattern(MissPattern pattern, double confidence) {}

    static List<RankedPattern> strongest(List<MissPattern> patterns, Instant now) {
        return patterns.stream()
                .map(p -> new RankedPattern(p, p.decayedConfidence(now)))
                .filter(r -> r.confidence() >= PATTERN_CONFIDENCE_FLOOR)
                .sorted(Comparator.comparingDouble(RankedPattern::confidence).reversed()
                        .thenComparing(Comparator.comparingInt((RankedPattern r) -> r.pattern().frequency()).reversed()))
                .limit(MAX_PATTERNS)
                .toList();
    }

    static String summarise(List<RankedPattern> ranked) {
        var sb = new StringBuilder(PATTERN_HEADER);
        for (RankedPattern entry : ranked) {
            MissPattern pattern = entry.pattern();
            sb.append("\n- ").append(pattern.direction().name().toLowerCase(Locale.ROOT))
              .append(" (").append(frequencyWord(pattern.frequency()));
            if (pattern.club() != null) {
                sb.append(" with ").append(pattern.club().name());
            }
            if (pattern.underPressure()) {
                sb.append(" under pressure");
            }
            sb.append(", ").append(Math.round(entry.confidence() * 100)).append("% confidence)");
        }
        return sb.toString();
    }

    static String frequencyWord(int frequency) {
        if (frequency >= 10) {
            return "frequently";
        }
        if (frequency >= 5) {
            return "occasionally";
        }
        return "sometimes";
    }

    private static String applyAll(List<Rewrite> rewrites, String text) {
        String result = text;
        for (Rewrite rewrite : rewrites) {
            result = rewrite.apply(result);
        }
        return result;
    }

    private static String tidy(String text) {
        String result = SPACE_RUNS.matcher(text).replaceAll(" ");
        result = SPACE_BEFORE_PUNCTUATION.matcher(result).replaceAll("$1");
        return result.trim();
    }
}
