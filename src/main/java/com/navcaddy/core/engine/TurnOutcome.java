package com.navcaddy.core.engine;

import com.navcaddy.core.error.ErrorKind;
import com.navcaddy.core.error.RecoveryAction;
import com.navcaddy.core.model.IntentSuggestion;
import com.navcaddy.core.model.ParsedIntent;
import com.navcaddy.core.model.RoutingTarget;
import com.navcaddy.core.persona.DisclaimerType;
import com.navcaddy.core.persona.FormattedResponse;

import java.util.List;

/**
 * Everything the caller needs to present one finished turn.
 *
 * @param outcome            which branch the turn took
 * @param message            text to show or speak
 * @param intent             classified intent, when there was one
 * @param target             destination for {@link Outcome#ROUTE}
 * @param suggestions        options for {@link Outcome#CLARIFY}, empty otherwise
 * @param disclaimerType     disclaimer attached to the message, or {@code null}
 * @param patternsReferenced miss patterns summarised in the message
 * @param errorKind          failure category for {@link Outcome#ERROR}
 * @param recoverable        whether the user can retry or follow up
 * @param recovery           suggested follow-up
 */
public record TurnOutcome(
    Outcome outcome,
    String message,
    ParsedIntent intent,
    RoutingTarget target,
    List<IntentSuggestion> suggestions,
    DisclaimerType disclaimerType,
    int patternsReferenced,
    ErrorKind errorKind,
    boolean recoverable,
    RecoveryAction recovery
) {

    public enum Outcome { ROUTE, CONFIRM, CLARIFY, ERROR }

    public TurnOutcome {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static TurnOutcome routed(ParsedIntent intent, RoutingTarget target, FormattedResponse response) {
        return new TurnOutcome(Outcome.ROUTE, response.text(), intent, target, List.of(),
                response.disclaimerType(), response.patternsReferenced(), null, true, RecoveryAction.NONE);
    }

    public static TurnOutcome confirm(ParsedIntent intent, String message) {
        return new TurnOutcome(Outcome.CONFIRM, message, intent, null, List.of(), null, 0, null, true,
                RecoveryAction.NONE);
    }

    public static TurnOutcome clarify(String message, List<IntentSuggestion> suggestions) {
        return new TurnOutcome(Outcome.CLARIFY, message, null, null, suggestions, null, 0, null, true,
                RecoveryAction.NONE);
    }

    public static TurnOutcome error(String message, ErrorKind kind, boolean recoverable, RecoveryAction recovery,
                                    ParsedIntent intent) {
        return new TurnOutcome(Outcome.ERROR, message, intent, null, List.of(), null, 0, kind, recoverable,
                recovery);
    }

    public boolean disclaimerAdded() {
        return disclaimerType != null;
    }

    public boolean isError() {
        return outcome == Outcome.ERROR;
    }
}
