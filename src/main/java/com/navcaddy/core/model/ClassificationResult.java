package com.navcaddy.core.model;

import com.navcaddy.core.error.ErrorKind;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of classifying one utterance. Exactly one of {@link Route}, {@link Confirm},
 * {@link Clarify} or {@link Error} is produced per call.
 * <p>
 * Consumers should go through {@link #fold}, which forces every variant to be handled.
 */
public sealed interface ClassificationResult extends Serializable
        permits ClassificationResult.Route, ClassificationResult.Confirm,
                ClassificationResult.Clarify, ClassificationResult.Error {

    int MAX_SUGGESTIONS = 3;

    <R> R fold(Function<Route, ? extends R> onRoute,
               Function<Confirm, ? extends R> onConfirm,
               Function<Clarify, ? extends R> onClarify,
               Function<Error, ? extends R> onError);

    /** High confidence: navigate straight to the target. */
    record Route(ParsedIntent intent, RoutingTarget target) implements ClassificationResult {

        public Route {
            Objects.requireNonNull(intent, "intent");
            Objects.requireNonNull(target, "target");
        }

        @Override
        public <R> R fold(Function<Route, ? extends R> onRoute, Function<Confirm, ? extends R> onConfirm,
                          Function<Clarify, ? extends R> onClarify, Function<Error, ? extends R> onError) {
            return onRoute.apply(this);
        }
    }

    /** Medium confidence: ask the user a yes/no question before acting. */
    record Confirm(ParsedIntent intent, String message) implements ClassificationResult {

        public Confirm {
            Objects.requireNonNull(intent, "intent");
            requireText(message);
        }

        @Override
        public <R> R fold(Function<Route, ? extends R> onRoute, Function<Confirm, ? extends R> onConfirm,
                          Function<Clarify, ? extends R> onClarify, Function<Error, ? extends R> onError) {
            return onConfirm.apply(this);
        }
    }

    /** Low confidence: offer between one and three alternatives. */
    record Clarify(String originalInput, String message, List<IntentSuggestion> suggestions)
            implements ClassificationResult {

        public Clarify {
            requireText(message);
            if (suggestions == null || suggestions.isEmpty() || suggestions.size() > MAX_SUGGESTIONS) {
                throw new IllegalArgumentException("clarification needs 1 to " + MAX_SUGGESTIONS
                        + " suggestions but got " + (suggestions == null ? 0 : suggestions.size()));
            }
            suggestions = List.copyOf(suggestions);
        }

        @Override
        public <R> R fold(Function<Route, ? extends R> onRoute, Function<Confirm, ? extends R> onConfirm,
                          Function<Clarify, ? extends R> onClarify, Function<Error, ? extends R> onError) {
            return onClarify.apply(this);
        }
    }

    /** Nothing usable was produced; {@code recoverable} tells the UI to offer a retry. */
    record Error(String message, ErrorKind kind, boolean recoverable) implements ClassificationResult {

        public Error {
            requireText(message);
            kind = kind == null ? ErrorKind.UNKNOWN : kind;
        }

        public Error(String message) {
            this(message, ErrorKind.UNKNOWN, true);
        }

        @Override
        public <R> R fold(Function<Route, ? extends R> onRoute, Function<Confirm, ? extends R> onConfirm,
                          Function<Clarify, ? extends R> onClarify, Function<Error, ? extends R> onError) {
            return onError.apply(this);
        }
    }

    private static void requireText(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
    }
}
