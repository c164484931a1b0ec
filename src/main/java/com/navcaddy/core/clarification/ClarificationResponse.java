package com.navcaddy.core.clarification;

import com.navcaddy.core.model.ClassificationResult;
import com.navcaddy.core.model.IntentSuggestion;

import java.util.List;

/**
 * A disambiguation question with one to three ranked suggestions.
 */
public record ClarificationResponse(
    String message,
    List<IntentSuggestion> suggestions,
    String originalInput
) {

    public ClarificationResponse {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("clarification message must not be blank");
        }
        if (suggestions == null || suggestions.isEmpty()
                || suggestions.size() > ClassificationResult.MAX_SUGGESTIONS) {
            throw new IllegalArgumentException("clarification needs 1 to " + ClassificationResult.MAX_SUGGESTIONS
                    + " suggestions but got " + (suggestions == null ? 0 : suggestions.size()));
        }
        suggestions = List.copyOf(suggestions);
    }

    public ClassificationResult.Clarify toResult() {
        return new ClassificationResult.Clarify(originalInput, message, suggestions);
    }
}
