package com.navcaddy.core.persona;

/**
 * Outcome of scanning one response.
 *
 * @param needsDisclaimer whether a disclaimer must be appended
 * @param disclaimerType  which disclaimer, or {@code null}
 * @param violatedRule    human description of the rule that matched, or {@code null}
 */
public record GuardrailResult(
    boolean needsDisclaimer,
    DisclaimerType disclaimerType,
    String violatedRule
) {

    private static final GuardrailResult CLEAN = new GuardrailResult(false, null, null);

    public static GuardrailResult clean() {
        return CLEAN;
    }

    public static GuardrailResult violation(DisclaimerType type, String rule) {
        return new GuardrailResult(true, type, rule);
    }
}
