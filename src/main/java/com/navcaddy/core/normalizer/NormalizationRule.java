package com.navcaddy.core.normalizer;

import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * One (pattern, replacement) pair. A {@code $1} in the replacement is filled from the first capture group.
 */
public record NormalizationRule(
    Pattern pattern,
    String replacement,
    ModificationType type
) {

    /**
     * Whole-phrase rule: words may be separated by any run of whitespace, matching is case-insensitive.
     */
    public static NormalizationRule phrase(String phrase, String replacement, ModificationType type) {
        String regex = "\\b" + Pattern.quote(phrase).replace(" ", "\\E\\s+\\Q") + "\\b";
        return new NormalizationRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement, type);
    }

    public static NormalizationRule regex(String regex, String replacement, ModificationType type) {
        return new NormalizationRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement, type);
    }

    String expand(MatchResult match) {
        if (match.groupCount() >= 1 && match.group(1) != null) {
            return replacement.replace("$1", match.group(1));
        }
        return replacement;
    }
}
