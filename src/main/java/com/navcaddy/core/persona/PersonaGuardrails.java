package com.navcaddy.core.persona;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Scans generated text for topics the caddy must not speak on without a disclaimer.
 * <p>
 * Rules are checked in priority order (medical, swing technique, betting, absolute guarantees) and
 * the first match decides the single disclaimer.
 */
@Component
public class PersonaGuardrails {

    record GuardrailRule(DisclaimerType type, String description, List<Pattern> patterns) {

        boolean matches(String text) {
            for (Pattern pattern : patterns) {
                if (pattern.matcher(text).find()) {
                    return true;
                }
            }
            return false;
        }
    }

    static final List<GuardrailRule> RULES = List.of(
            new GuardrailRule(DisclaimerType.MEDICAL, "Response discusses medical or physical health topics",
                    patterns(
                            "\\b(pain|injury|injured|hurt|strain|sprain|tear|inflammation)\\b",
                            "\\b(doctor|physician|physical therapy|medical)\\b",
                            "\\b(diagnose|diagnosis|treatment|heal|recovery time)\\b",
                            "\\b(tendonitis|arthritis|nerve|muscle damage)\\b")),
            new GuardrailRule(DisclaimerType.SWING_TECHNIQUE, "Response provides swing technique advice",
                    patterns(
                            "\\b(swing path|swing plane|club ?face|impact position)\\b",
                            "\\b(grip pressure|grip change|stance width|ball position)\\b",
                            "\\b(weight shift|hip rotation|shoulder turn|backswing)\\b",
                            "\\b(wrist hinge|release point|follow through)\\b")),
            new GuardrailRule(DisclaimerType.BETTING, "Response discusses betting or gambling",
                    patterns(
                            "\\b(bet|bets|wager|gamble|odds|spread)\\b",
                            "\\b(gambling|betting line|over under)\\b",
                            "\\bmoney on\\b")),
            new GuardrailRule(DisclaimerType.SAFETY, "Response contains absolute guarantees",
                    patterns(
                            "\\bwill (fix|cure|eliminate|stop|prevent)\\b",
                            "\\b(guaranteed|guarantee|definitely|certainly) (fix|improve|solve)\\b",
                            "\\bguaranteed\\b",
                            "\\bthis will\\b",
                            "\\byou['\u2019]ll never\\b"))
    );

    public GuardrailResult check(String response) {
        if (response == null || response.isBlank()) {
            return GuardrailResult.clean();
        }
        for (GuardrailRule rule : RULES) {
            if (rule.matches(response)) {
                return GuardrailResult.violation(rule.type(), rule.description());
            }
        }
        return GuardrailResult.clean();
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
