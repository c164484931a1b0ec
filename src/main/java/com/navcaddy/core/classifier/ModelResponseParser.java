package com.navcaddy.core.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.navcaddy.core.intent.IntentRegistry;
import com.navcaddy.core.llm.LlmParseException;
import com.navcaddy.core.model.ClubParser;
import com.navcaddy.core.model.ExtractedEntities;
import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.Lie;
import com.navcaddy.core.model.ParsedIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the model's JSON reply into a {@link ParsedIntent}.
 * <p>
 * {@code intent_type} and {@code confidence} are validated strictly and any violation raises
 * {@link LlmParseException}. Entities are read tolerantly: a malformed entity is dropped, never fatal.
 */
@Component
public class ModelResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ModelResponseParser.class);

    private static final Pattern INTEGER_TEXT =
            Pattern.compile("\\s*(-?\\d{1,6})\\s*(?:/\\s*10|yards?|yds?)?\\s*", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper mapper;

    public ModelResponseParser() {
        this(new ObjectMapper());
    }

    public ModelResponseParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ParsedIntent parse(String rawResponse) {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw new LlmParseException("Model reply was empty");
        }
        JsonNode root;
        try {
            root = mapper.readTree(extractJson(rawResponse));
        } catch (JsonProcessingException e) {
            throw new LlmParseException("Model reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new LlmParseException("Model reply is not a JSON object");
        }

        IntentType intentType = readIntentType(root.get("intent_type"));
        double confidence = readConfidence(root.get("confidence"));
        ExtractedEntities entities = readEntities(root.get("entities"));
        String userGoal = text(root.get("user_goal"));

        return new ParsedIntent(intentType, confidence, entities, userGoal,
                IntentRegistry.resolveTarget(intentType, entities));
    }

    private static IntentType readIntentType(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new LlmParseException("Missing required field intent_type");
        }
        String value = node.asText().trim().toUpperCase(Locale.ROOT);
        try {
            return IntentType.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new LlmParseException("Unknown intent_type: " + value, e);
        }
    }

    private static double readConfidence(JsonNode node) {
        if (node == null || !node.isNumber()) {
            throw new LlmParseException("Missing or non-numeric field confidence");
        }
        double value = node.asDouble();
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new LlmParseException("confidence out of range [0, 1]: " + value);
        }
        return value;
    }

    private static ExtractedEntities readEntities(JsonNode node) {
        if (node == null || node.isNull()) {
            return ExtractedEntities.empty();
        }
        if (!node.isObject()) {
            log.debug("Ignoring non-object entities node of type {}", node.getNodeType());
            return ExtractedEntities.empty();
        }
        return new ExtractedEntities(
                ClubParser.parse(text(node.get("club"))),
                integer(node.get("yardage")),
                Lie.parse(text(node.get("lie"))),
                text(node.get("wind")),
                integer(node.get("fatigue")),
                pain(node.get("pain")),
                text(node.get("score_context")),
                integer(node.get("hole_number")));
    }

    /**
     * Strips markdown code fences and any prose around the outermost JSON object.
     */
    static String extractJson(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start > 0 && end > start) {
            cleaned = cleaned.substring(start, end + 1);
        }
        return cleaned;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isValueNode()) {
            String value = node.asText();
            return value.isBlank() ? null : value.trim();
        }
        return null;
    }

    /**
     * Reads a whole number. Text must be a single integer, optionally followed by a unit or an
     * out-of-ten scale ("150 yards", "3/10"); ranges, decimals and anything else yield {@code null}.
     */
    private static Integer integer(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? node.intValue() : null;
        }
        if (node.isNumber()) {
            double value = node.doubleValue();
            return value == Math.rint(value) && Math.abs(value) <= Integer.MAX_VALUE ? (int) value : null;
        }
        if (node.isTextual()) {
            Matcher matcher = INTEGER_TEXT.matcher(node.asText());
            return matcher.matches() ? Integer.valueOf(matcher.group(1)) : null;
        }
        return null;
    }

    private static String pain(JsonNode node) {
        if (node != null && node.isBoolean()) {
            return node.asBoolean() ? "reported" : null;
        }
        return text(node);
    }
}
