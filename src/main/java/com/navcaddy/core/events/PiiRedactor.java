package com.navcaddy.core.events;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Masks personal data in free text before it leaves the process in an analytics payload.
 */
public final class PiiRedactor {

    private record Redaction(Pattern pattern, String mask) {}

    // Card before phone so long digit runs are not half-matched as phone numbers.
    private static final List<Redaction> REDACTIONS = List.of(
            new Redaction(Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}"), "[EMAIL]"),
            new Redaction(Pattern.compile("\\b\\d(?:[ -]?\\d){12,15}\\b"), "[CARD]"),
            new Redaction(Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), "[SSN]"),
            new Redaction(Pattern.compile("(?:\\+?1[ .-]?)?\\(?\\b\\d{3}\\)?[ .-]?\\d{3}[ .-]?\\d{4}\\b"), "[PHONE]"),
            new Redaction(Pattern.compile(
                    "\\b\\d{1,5}\\s+(?:[A-Z][a-z]+\\s+){1,3}"
                            + "(?i:Street|St|Avenue|Ave|Road|Rd|Boulevard|Blvd|Lane|Ln|Drive|Dr|Court|Ct|Way)\\b\\.?"),
                    "[ADDRESS]")
    );

    private PiiRedactor() {}

    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Redaction redaction : REDACTIONS) {
            result = redaction.pattern().matcher(result).replaceAll(redaction.mask());
        }
        return result;
    }
}
