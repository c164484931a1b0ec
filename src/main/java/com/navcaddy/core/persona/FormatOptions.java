package com.navcaddy.core.persona;

/**
 * Caller switches for one {@link ResponseFormatter#format} call.
 *
 * @param includePatterns   append the player's strongest miss patterns
 * @param forcedDisclaimer  disclaimer to attach even when the response text itself is clean,
 *                          used when the user's input was sensitive (e.g. mentioned pain); {@code null} for none
 */
public record FormatOptions(boolean includePatterns, DisclaimerType forcedDisclaimer) {

    public static FormatOptions defaults() {
        return new FormatOptions(false, null);
    }

    public static FormatOptions withPatterns() {
        return new FormatOptions(true, null);
    }

    public FormatOptions forceDisclaimer(DisclaimerType type) {
        return new FormatOptions(includePatterns, type);
    }

    public boolean forcesDisclaimer() {
        return forcedDisclaimer != null;
    }
}
