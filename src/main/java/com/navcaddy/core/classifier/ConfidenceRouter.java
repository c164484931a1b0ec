package com.navcaddy.core.classifier;

import com.navcaddy.core.clarification.ClarificationGenerator;
import com.navcaddy.core.intent.IntentRegistry;
import com.navcaddy.core.model.ClassificationResult;
import com.navcaddy.core.model.ConfidenceThresholds;
import com.navcaddy.core.model.ExtractedEntities;
import com.navcaddy.core.model.ParsedIntent;
import com.navcaddy.core.model.RoutingTarget;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Locale;

/**
 * Maps a parsed intent to its outcome purely by confidence: route at 0.75 and above, confirm from
 * 0.50 up to 0.75, clarify below 0.50.
 */
@Component
public class ConfidenceRouter {

    static final String GENERIC_CONFIRMATION = "I'll help you with that.";

    private final ClarificationGenerator clarificationGenerator;

    public ConfidenceRouter(ClarificationGenerator clarificationGenerator) {
        this.clarificationGenerator = clarificationGenerator;
    }

    /**
     * @param intent          the parsed intent
     * @param normalizedInput input after normalization, used for clarification cues
     * @param originalInput   input as the user gave it, echoed back in clarifications
     */
    public ClassificationResult route(ParsedIntent intent, String normalizedInput, String originalInput) {
        return switch (ConfidenceThresholds.tierFor(intent.confidence())) {
            case ROUTE -> routeOrAcknowledge(intent);
            case CONFIRM -> new ClassificationResult.Confirm(intent, confirmationMessage(intent));
            case CLARIFY -> {
                var response = clarificationGenerator.generate(normalizedInput, intent);
                yield new ClassificationResult.Clarify(originalInput, response.message(), response.suggestions());
            }
        };
    }

    private static ClassificationResult routeOrAcknowledge(ParsedIntent intent) {
        RoutingTarget target = intent.routingTarget() != null
                ? intent.routingTarget()
                : IntentRegistry.resolveTarget(intent.intentType(), intent.entities());
        if (target == null) {
            // pure-answer intents have nowhere to navigate
            return new ClassificationResult.Confirm(intent, GENERIC_CONFIRMATION);
        }
        return new ClassificationResult.Route(intent, target);
    }

    /**
     * "Did you want to club adjustment? (with 7-Iron, at 150 yards, from rough)". Names the extracted
     * club, yardage and lie so a misheard entity can be corrected.
     */
    static String confirmationMessage(ParsedIntent intent) {
        String displayName = IntentRegistry.getSchema(intent.intentType()).displayName().toLowerCase(Locale.ROOT);
        var sb = new StringBuilder("Did you want to ").append(displayName).append('?');

        ExtractedEntities entities = intent.entities();
        var details = new ArrayList<String>();
        if (entities.club() != null) {
            details.add("with " + entities.club().name());
        }
        if (entities.yardage() != null) {
            details.add("at " + entities.yardage() + " yards");
        }
        if (entities.lie() != null) {
            details.add("from " + entities.lie().name().toLowerCase(Locale.ROOT));
        }
        if (entities.holeNumber() != null && details.isEmpty()) {
            details.add("on hole " + entities.holeNumber());
        }
        if (!details.isEmpty()) {
            sb.append(" (").append(String.join(", ", details)).append(')');
        }
        return sb.toString();
    }
}
