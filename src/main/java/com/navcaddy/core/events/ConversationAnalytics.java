package com.navcaddy.core.events;

import com.navcaddy.core.model.IntentSuggestion;
import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.ParsedIntent;
import com.navcaddy.core.model.RoutingTarget;
import com.navcaddy.core.error.ErrorKind;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes typed conversation analytics onto the {@link EventBus}.
 * <p>
 * Payloads describe the shape of a turn (lengths, intents, confidences, targets) and never the
 * user's words. Error text is passed through {@link PiiRedactor} first.
 */
@Service
public class ConversationAnalytics {

    public static final String INPUT_RECEIVED = "input.received";
    public static final String INTENT_CLASSIFIED = "intent.classified";
    public static final String ROUTE_EXECUTED = "route.executed";
    public static final String CLARIFICATION_REQUESTED = "clarification.requested";
    public static final String SUGGESTION_SELECTED = "suggestion.selected";
    public static final String ERROR_OCCURRED = "error.occurred";
    public static final String SESSION_ENDED = "session.ended";

    private final EventBus eventBus;
    private final Clock clock;

    public ConversationAnalytics(EventBus eventBus) {
        this(eventBus, Clock.systemUTC());
    }

    ConversationAnalytics(EventBus eventBus, Clock clock) {
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public void inputReceived(String sessionId, InputType inputType, int length) {
        publish(INPUT_RECEIVED, sessionId, Map.of("inputType", inputType.name(), "length", length));
    }

    public void intentClassified(String sessionId, ParsedIntent intent, long latencyMs, boolean success) {
        var payload = new LinkedHashMap<String, Object>();
        if (intent != null) {
            payload.put("intent", intent.intentType().name());
            payload.put("confidence", intent.confidence());
        }
        payload.put("latencyMs", latencyMs);
        payload.put("success", success);
        publish(INTENT_CLASSIFIED, sessionId, payload);
    }

    public void routeExecuted(String sessionId, RoutingTarget target) {
        publish(ROUTE_EXECUTED, sessionId, Map.of("module", target.module().name(), "screen", target.screen()));
    }

    public void clarificationRequested(String sessionId, List<IntentSuggestion> suggestions) {
        List<String> intents = suggestions.stream().map(s -> s.intentType().name()).toList();
        publish(CLARIFICATION_REQUESTED, sessionId, Map.of("suggestions", intents));
    }

    public void suggestionSelected(String sessionId, IntentType intent) {
        publish(SUGGESTION_SELECTED, sessionId, Map.of("intent", intent.name()));
    }

    public void errorOccurred(String sessionId, ErrorKind kind, boolean recoverable, String message) {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("kind", kind.name());
        payload.put("recoverable", recoverable);
        if (message != null) {
            payload.put("message", PiiRedactor.redact(message));
        }
        publish(ERROR_OCCURRED, sessionId, payload);
    }

    public void sessionEnded(String sessionId, int turns) {
        publish(SESSION_ENDED, sessionId, Map.of("turns", turns));
    }

    private void publish(String type, String sessionId, Map<String, Object> payload) {
        eventBus.publish(new AnalyticsEvent(type, sessionId, payload, Instant.now(clock)));
    }
}
