package com.navcaddy.core.normalizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites raw utterances into canonical text before classification.
 * <p>
 * Stages run in a fixed order: profanity masking, spoken compound numbers, club abbreviations and
 * golf slang, single number words, then whitespace clean-up. The stages are re-applied until the
 * text stops changing, which makes {@link #normalize(String)} idempotent.
 */
@Component
public class InputNormalizer {

    private static final Logger log = LoggerFactory.getLogger(InputNormalizer.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_PASSES = 4;

    private final List<List<NormalizationRule>> stages;

    public InputNormalizer() {
        this(List.of(
                NormalizationRules.PROFANITY,
                NormalizationRules.COMPOUND_NUMBERS,
                NormalizationRules.SLANG,
                NormalizationRules.NUMBER_WORDS));
    }

    InputNormalizer(List<List<NormalizationRule>> stages) {
        this.stages = List.copyOf(stages);
    }

    public String normalize(String raw) {
        return normalizeWithDetails(raw).normalizedInput();
    }

    public NormalizationResult normalizeWithDetails(String raw) {
        if (raw == null) {
            return NormalizationResult.unchanged("");
        }
        if (raw.isBlank()) {
            return new NormalizationResult(raw, "", List.of());
        }
        var modifications = new ArrayList<Modification>();
        String current = raw;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = applyStages(current, modifications);
            if (next.equals(current)) {
                return new NormalizationResult(raw, next, modifications);
            }
            current = next;
        }
        log.warn("Normalization did not settle after {} passes ({} chars)", MAX_PASSES, raw.length());
        return new NormalizationResult(raw, current, modifications);
    }

    private String applyStages(String text, List<Modification> modifications) {
        String result = text;
        for (List<NormalizationRule> stage : stages) {
            for (NormalizationRule rule : stage) {
                result = apply(rule, result, modifications);
            }
        }
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    private static String apply(NormalizationRule rule, String text, List<Modification> modifications) {
        Matcher matcher = rule.pattern().matcher(text);
        if (!matcher.find()) {
            return text;
        }
        matcher.reset();
        return matcher.replaceAll(match -> {
            String replacement = rule.expand(match);
            modifications.add(new Modification(rule.type(), match.group(), replacement));
            return Matcher.quoteReplacement(replacement);
        });
    }
}
