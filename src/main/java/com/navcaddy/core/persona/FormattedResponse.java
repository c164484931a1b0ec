package com.navcaddy.core.persona;

/**
 * Final user-facing text after guardrails and voice clean-up.
 *
 * @param text               response text, disclaimer and pattern block included
 * @param disclaimerAdded    whether a disclaimer block was appended
 * @param disclaimerType     the appended disclaimer, or {@code null}
 * @param patternsReferenced number of miss patterns summarised in the text
 */
public record FormattedResponse(
    String text,
    boolean disclaimerAdded,
    DisclaimerType disclaimerType,
    int patternsReferenced
) {
}
