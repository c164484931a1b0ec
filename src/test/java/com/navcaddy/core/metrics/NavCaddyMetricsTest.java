package com.navcaddy.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NavCaddyMetricsTest {

    private SimpleMeterRegistry registry;
    private NavCaddyMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new NavCaddyMetrics(registry);
    }

    @Test
    @DisplayName("recordClassificationOutcome counts by outcome tag")
    void recordClassificationOutcome() {
        metrics.recordClassificationOutcome("route");
        metrics.recordClassificationOutcome("route");
        metrics.recordClassificationOutcome("clarify");

        assertEquals(2.0, registry.find("navcaddy.classification.outcomes").tag("outcome", "route")
                .counter().count());
        assertEquals(1.0, registry.find("navcaddy.classification.outcomes").tag("outcome", "clarify")
                .counter().count());
    }

    @Test
    @DisplayName("recordModelCall creates a timer tagged by success")
    void recordModelCall() {
        metrics.recordModelCall(800, true);
        metrics.recordModelCall(10_000, false);

        var ok = registry.find("navcaddy.model.duration").tag("success", "true").timer();
        var failed = registry.find("navcaddy.model.duration").tag("success", "false").timer();
        assertNotNull(ok);
        assertNotNull(failed);
        assertEquals(1, ok.count());
    }

    @Test
    @DisplayName("recordModelFailure counts by reason")
    void recordModelFailure() {
        metrics.recordModelFailure("classification_timeout");

        assertEquals(1.0, registry.find("navcaddy.model.failures").tag("reason", "classification_timeout")
                .counter().count());
    }

    @Test
    @DisplayName("recordDisclaimer and recordSupersededTurn increment counters")
    void counters() {
        metrics.recordDisclaimer("medical");
        metrics.recordSupersededTurn();
        metrics.recordSupersededTurn();

        assertEquals(1.0, registry.find("navcaddy.guardrail.disclaimers").tag("type", "medical").counter().count());
        assertEquals(2.0, registry.find("navcaddy.turns.superseded").counter().count());
    }

    @Test
    @DisplayName("recordClarificationSuggestions records a distribution")
    void recordClarificationSuggestions() {
        metrics.recordClarificationSuggestions(3);
        metrics.recordClarificationSuggestions(1);

        var summary = registry.find("navcaddy.clarification.suggestions").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(4.0, summary.totalAmount());
    }
}
