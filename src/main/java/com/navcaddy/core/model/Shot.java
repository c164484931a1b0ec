package com.navcaddy.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A recorded shot. Durable shot history lives in the external store; the session only keeps the last one.
 *
 * @param id              external shot id
 * @param timestamp       when the shot was hit
 * @param club            club used
 * @param missDirection   miss, or {@code null} for a good shot
 * @param lie             lie the shot was hit from
 * @param pressureContext pressure flags (never null)
 * @param holeNumber      hole the shot was hit on (nullable)
 * @param notes           free-text notes (nullable)
 */
public record Shot(
    String id,
    Instant timestamp,
    Club club,
    MissDirection missDirection,
    Lie lie,
    PressureContext pressureContext,
    Integer holeNumber,
    String notes
) implements Serializable {

    public Shot {
        Objects.requireNonNull(club, "club");
        timestamp = timestamp == null ? Instant.now() : timestamp;
        pressureContext = pressureContext == null ? PressureContext.none() : pressureContext;
    }
}
