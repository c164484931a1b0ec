package com.navcaddy.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.navcaddy.core.engine.TurnOutcome;
import com.navcaddy.core.model.IntentSuggestion;
import com.navcaddy.core.model.RoutingTarget;

import java.util.List;
import java.util.Map;

/**
 * JSON response for one conversation turn.
 */
public record TurnResponse(
    String outcome,
    String message,
    String intent,
    Double confidence,
    Target target,
    List<Suggestion> suggestions,
    @JsonProperty("disclaimer_added") boolean disclaimerAdded,
    @JsonProperty("disclaimer_type") String disclaimerType,
    @JsonProperty("patterns_referenced") int patternsReferenced,
    @JsonProperty("error_kind") String errorKind,
    boolean recoverable,
    String recovery
) {

    public record Target(String module, String screen, Map<String, String> parameters) {

        static Target from(RoutingTarget target) {
            return target == null ? null
                    : new Target(target.module().name(), target.screen(), target.parameters());
        }
    }

    public record Suggestion(
        @JsonProperty("intent_type") String intentType,
        String label,
        String description
    ) {

        static Suggestion from(IntentSuggestion suggestion) {
            return new Suggestion(suggestion.intentType().name(), suggestion.label(), suggestion.description());
        }
    }

    public static TurnResponse from(TurnOutcome outcome) {
        return new TurnResponse(
                outcome.outcome().name(),
                outcome.message(),
                outcome.intent() != null ? outcome.intent().intentType().name() : null,
                outcome.intent() != null ? outcome.intent().confidence() : null,
                Target.from(outcome.target()),
                outcome.suggestions().stream().map(Suggestion::from).toList(),
                outcome.disclaimerAdded(),
                outcome.disclaimerType() != null ? outcome.disclaimerType().name() : null,
                outcome.patternsReferenced(),
                outcome.errorKind() != null ? outcome.errorKind().name() : null,
                outcome.recoverable(),
                outcome.recovery() != null ? outcome.recovery().name() : null);
    }
}
