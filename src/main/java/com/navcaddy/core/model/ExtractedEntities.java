package com.navcaddy.core.model;

import java.io.Serializable;

/**
 * Entities pulled out of an utterance. Every field is optional.
 * <p>
 * Out-of-range numbers are tolerated rather than rejected: yardage must be positive,
 * hole number must be 1..18 (otherwise both become {@code null}) and fatigue is clamped into 1..10.
 *
 * @param club         resolved club reference
 * @param yardage      target distance in yards
 * @param lie          lie or terrain category
 * @param wind         free-text wind description
 * @param fatigue      self-reported fatigue, 1..10
 * @param pain         pain description or body location
 * @param scoreContext free-text scoring situation
 * @param holeNumber   hole being referred to, 1..18
 */
public record ExtractedEntities(
    Club club,
    Integer yardage,
    Lie lie,
    String wind,
    Integer fatigue,
    String pain,
    String scoreContext,
    Integer holeNumber
) implements Serializable {

    public static final int MIN_FATIGUE = 1;
    public static final int MAX_FATIGUE = 10;
    public static final int MIN_HOLE = 1;
    public static final int MAX_HOLE = 18;

    private static final ExtractedEntities EMPTY =
            new ExtractedEntities(null, null, null, null, null, null, null, null);

    public ExtractedEntities {
        if (yardage != null && yardage <= 0) {
            yardage = null;
        }
        if (fatigue != null) {
            fatigue = Math.max(MIN_FATIGUE, Math.min(MAX_FATIGUE, fatigue));
        }
        if (holeNumber != null && (holeNumber < MIN_HOLE || holeNumber > MAX_HOLE)) {
            holeNumber = null;
        }
        wind = blankToNull(wind);
        pain = blankToNull(pain);
        scoreContext = blankToNull(scoreContext);
    }

    public static ExtractedEntities empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return club == null && yardage == null && lie == null && wind == null
                && fatigue == null && pain == null && scoreContext == null && holeNumber == null;
    }

    public boolean hasPain() {
        return pain != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
