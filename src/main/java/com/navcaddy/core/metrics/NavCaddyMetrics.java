package com.navcaddy.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the conversation pipeline.
 */
@Service
public class NavCaddyMetrics {

    private final MeterRegistry registry;

    public NavCaddyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "route", "confirm", "clarify" or "error"
     */
    public void recordClassificationOutcome(String outcome) {
        Counter.builder("navcaddy.classification.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordModelCall(long ms, boolean success) {
        Timer.builder("navcaddy.model.duration")
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param reason error kind, e.g. "classification_timeout" or "invalid_model_response"
     */
    public void recordModelFailure(String reason) {
        Counter.builder("navcaddy.model.failures")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDisclaimer(String type) {
        Counter.builder("navcaddy.guardrail.disclaimers")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    /** A turn was cancelled because a newer input arrived for the same session. */
    public void recordSupersededTurn() {
        Counter.builder("navcaddy.turns.superseded")
                .description("Turns abandoned in favour of a newer input")
                .register(registry)
                .increment();
    }

    public void recordClarificationSuggestions(int count) {
        DistributionSummary.builder("navcaddy.clarification.suggestions")
                .description("Suggestions offered per clarification")
                .register(registry)
                .record(count);
    }
}
