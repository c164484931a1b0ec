package com.navcaddy.core.events;

import com.navcaddy.core.error.ErrorKind;
import com.navcaddy.core.model.IntentSuggestion;
import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.Module;
import com.navcaddy.core.model.ParsedIntent;
import com.navcaddy.core.model.RoutingTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationAnalyticsTest {

    private static final Instant NOW = Instant.parse("2026-05-01T09:30:00Z");

    private final List<AnalyticsEvent> received = new ArrayList<>();
    private ConversationAnalytics analytics;

    @BeforeEach
    void setUp() {
        var bus = new EventBus();
        bus.subscribeAll(received::add);
        analytics = new ConversationAnalytics(bus, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private AnalyticsEvent only() {
        assertEquals(1, received.size());
        return received.get(0);
    }

    @Test
    @DisplayName("input event carries type and length but not the text")
    void inputReceived() {
        analytics.inputReceived("S-1", InputType.VOICE, 22);

        AnalyticsEvent event = only();
        assertEquals(ConversationAnalytics.INPUT_RECEIVED, event.eventType());
        assertEquals("S-1", event.sessionId());
        assertEquals("VOICE", event.payload().get("inputType"));
        assertEquals(22, event.payload().get("length"));
        assertEquals(NOW, event.timestamp());
    }

    @Test
    @DisplayName("classification event records intent, confidence and latency")
    void intentClassified() {
        var intent = new ParsedIntent(IntentType.CLUB_ADJUSTMENT, 0.85, null, null, null);

        analytics.intentClassified("S-1", intent, 420, true);

        AnalyticsEvent event = only();
        assertEquals("CLUB_ADJUSTMENT", event.payload().get("intent"));
        assertEquals(0.85, event.payload().get("confidence"));
        assertEquals(420L, event.payload().get("latencyMs"));
        assertEquals(true, event.payload().get("success"));
    }

    @Test
    @DisplayName("failed classification omits the intent")
    void failedClassification() {
        analytics.intentClassified("S-1", null, 10_000, false);

        assertFalse(only().payload().containsKey("intent"));
    }

    @Test
    void routeAndClarify() {
        analytics.routeExecuted("S-1", new RoutingTarget(Module.COACH, "DrillScreen"));
        analytics.clarificationRequested("S-1", List.of(
                new IntentSuggestion(IntentType.RECOVERY_CHECK, "Check Recovery", "Check recovery"),
                new IntentSuggestion(IntentType.PATTERN_QUERY, "View Patterns", "Patterns")));
        analytics.suggestionSelected("S-1", IntentType.PATTERN_QUERY);

        assertEquals("DrillScreen", received.get(0).payload().get("screen"));
        assertEquals(List.of("RECOVERY_CHECK", "PATTERN_QUERY"), received.get(1).payload().get("suggestions"));
        assertEquals(ConversationAnalytics.SUGGESTION_SELECTED, received.get(2).eventType());
    }

    @Test
    @DisplayName("error messages are redacted before publishing")
    void errorRedacted() {
        analytics.errorOccurred("S-1", ErrorKind.UNKNOWN, true, "failed for pat@example.com");

        AnalyticsEvent event = only();
        assertEquals("UNKNOWN", event.payload().get("kind"));
        assertEquals("failed for [EMAIL]", event.payload().get("message"));
    }
}
