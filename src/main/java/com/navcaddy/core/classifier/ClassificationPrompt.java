package com.navcaddy.core.classifier;

import com.navcaddy.core.intent.IntentRegistry;
import com.navcaddy.core.intent.IntentSchema;
import com.navcaddy.core.persona.BonesPersona;

/**
 * System prompt for intent classification: the persona, the supported intents with examples, the
 * entity vocabulary and the required JSON reply shape. Built once from {@link IntentRegistry}.
 */
final class ClassificationPrompt {

    private static final String INSTRUCTIONS = """
            Your current task is to classify what the golfer wants. Do not answer the request.

            # Supported Intents
            %s
            # Entities
            - club: golf club (e.g. "7-iron", "driver", "pitching wedge")
            - yardage: distance in yards (positive integer)
            - lie: ball position (tee, fairway, rough, bunker, green, fringe, hazard)
            - wind: wind description (e.g. "10mph left-to-right")
            - fatigue: fatigue level on a 1-10 scale
            - pain: pain description or body location
            - score_context: scoring situation (e.g. "1 under", "leading by 2")
            - hole_number: specific hole (1-18)

            # Output Format
            Respond with a single JSON object and nothing else:
            {
              "intent_type": "<one of the intent names above>",
              "confidence": <number between 0 and 1>,
              "entities": { "club": "7-iron", "yardage": null, ... },
              "user_goal": "<short description of what the golfer wants>"
            }
            Use null for entities that are not mentioned. Lower the confidence when the request is ambiguous.
            """;

    private static final String PROMPT = BonesPersona.systemPrompt() + "\n" + INSTRUCTIONS.formatted(intents());

    private ClassificationPrompt() {}

    static String systemPrompt() {
        return PROMPT;
    }

    private static String intents() {
        var sb = new StringBuilder();
        for (IntentSchema schema : IntentRegistry.getAllSchemas()) {
            sb.append("## ").append(schema.intentType().name()).append('\n');
            sb.append("Description: ").append(schema.description()).append('\n');
            sb.append("Examples:\n");
            for (String phrase : schema.examplePhrases()) {
                sb.append("  - \"").append(phrase).append("\"\n");
            }
        }
        return sb.toString();
    }
}
