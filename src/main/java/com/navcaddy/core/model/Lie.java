package com.navcaddy.core.model;

import java.util.Locale;

/**
 * Where the ball is sitting.
 */
public enum Lie {
    TEE,
    FAIRWAY,
    ROUGH,
    BUNKER,
    GREEN,
    FRINGE,
    HAZARD;

    /**
     * Maps a free-text lie description to a category by keyword, or {@code null} when unrecognised.
     */
    public static Lie parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.toLowerCase(Locale.ROOT);
        if (value.contains("fairway")) return FAIRWAY;
        if (value.contains("rough")) return ROUGH;
        if (value.contains("bunker") || value.contains("sand") || value.contains("trap")) return BUNKER;
        if (value.contains("fringe") || value.contains("apron")) return FRINGE;
        if (value.contains("green")) return GREEN;
        if (value.contains("tee")) return TEE;
        if (value.contains("hazard") || value.contains("water") || value.contains("penalty")) return HAZARD;
        return null;
    }
}
