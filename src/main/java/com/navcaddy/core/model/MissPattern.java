package com.navcaddy.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A recurring miss for this player, read from the pattern store.
 *
 * @param direction       which way the ball tends to go
 * @param club            club the pattern applies to, or {@code null} for all clubs
 * @param frequency       number of occurrences, at least 1
 * @param confidence      pattern strength in [0, 1]
 * @param pressureContext pressure situation the pattern shows up in (nullable)
 * @param lastOccurrence  most recent occurrence
 */
public record MissPattern(
    MissDirection direction,
    Club club,
    int frequency,
    double confidence,
    PressureContext pressureContext,
    Instant lastOccurrence
) implements Serializable {

    /** Confidence halves every 14 days without a fresh occurrence. */
    public static final Duration DECAY_HALF_LIFE = Duration.ofDays(14);

    public MissPattern {
        Objects.requireNonNull(direction, "direction");
        if (frequency <= 0) {
            throw new IllegalArgumentException("frequency must be positive but was " + frequency);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1] but was " + confidence);
        }
        lastOccurrence = lastOccurrence == null ? Instant.now() : lastOccurrence;
    }

    /**
     * Confidence decayed by the time since the last occurrence.
     */
    public double decayedConfidence(Instant now) {
        double days = Math.max(0, Duration.between(lastOccurrence, now).toMillis()) / 86_400_000.0;
        return confidence * Math.pow(0.5, days / DECAY_HALF_LIFE.toDays());
    }

    public boolean underPressure() {
        return pressureContext != null && pressureContext.hasPressure();
    }
}
