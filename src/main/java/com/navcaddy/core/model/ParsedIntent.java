package com.navcaddy.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Structured interpretation of one utterance.
 *
 * @param intentType    classified intent
 * @param confidence    model certainty in [0, 1]; anything else fails construction
 * @param entities      extracted entities (never null)
 * @param userGoal      short free-text goal reported by the model (nullable)
 * @param routingTarget destination for the intent, or {@code null} for pure-answer intents
 */
public record ParsedIntent(
    IntentType intentType,
    double confidence,
    ExtractedEntities entities,
    String userGoal,
    RoutingTarget routingTarget
) implements Serializable {

    public ParsedIntent {
        Objects.requireNonNull(intentType, "intentType");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1] but was " + confidence);
        }
        entities = entities == null ? ExtractedEntities.empty() : entities;
    }
}
