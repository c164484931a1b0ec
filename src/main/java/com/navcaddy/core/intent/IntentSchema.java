package com.navcaddy.core.intent;

import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.RoutingTarget;

import java.util.List;
import java.util.Set;

/**
 * Static description of one intent: how to present it and where it routes.
 *
 * @param intentType           the intent described
 * @param displayName          human name, e.g. "Club Adjustment"
 * @param description          one-line purpose, shown with clarification suggestions
 * @param suggestionLabel      short button label, e.g. "Adjust Club"
 * @param requiredEntities     entities the downstream screen needs
 * @param optionalEntities     entities the downstream screen can use
 * @param examplePhrases       representative utterances, used in the model prompt and keyword matching
 * @param defaultRoutingTarget destination, or {@code null} when the intent is answered without navigation
 */
public record IntentSchema(
    IntentType intentType,
    String displayName,
    String description,
    String suggestionLabel,
    Set<EntityType> requiredEntities,
    Set<EntityType> optionalEntities,
    List<String> examplePhrases,
    RoutingTarget defaultRoutingTarget
) {

    public IntentSchema {
        requiredEntities = Set.copyOf(requiredEntities);
        optionalEntities = Set.copyOf(optionalEntities);
        examplePhrases = List.copyOf(examplePhrases);
    }

    public boolean navigates() {
        return defaultRoutingTarget != null;
    }
}
