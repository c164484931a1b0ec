package com.navcaddy.core.model;

import java.io.Serializable;

/**
 * Whether a shot was hit under pressure, either tagged by the user or inferred from the score.
 *
 * @param userTagged     user explicitly marked the shot as a pressure shot
 * @param inferred       pressure was inferred from scoring context
 * @param scoringContext free-text score situation, e.g. "1 under on 18" (nullable)
 */
public record PressureContext(
    boolean userTagged,
    boolean inferred,
    String scoringContext
) implements Serializable {

    public static PressureContext none() {
        return new PressureContext(false, false, null);
    }

    public boolean hasPressure() {
        return userTagged || inferred;
    }
}
