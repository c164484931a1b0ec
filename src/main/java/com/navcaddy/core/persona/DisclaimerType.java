package com.navcaddy.core.persona;

/**
 * Disclaimers the formatter can append, each with its fixed text.
 */
public enum DisclaimerType {
    MEDICAL("*Note: This is general information only. For pain, injury concerns, or persistent physical issues,"
            + " please consult with a qualified medical professional or physical therapist.*"),
    SWING_TECHNIQUE("*Note: This is general guidance. For personalized swing instruction,"
            + " consider working with a certified golf professional.*"),
    BETTING("*Note: NavCaddy does not provide betting or gambling advice."
            + " Please bet responsibly and within your means.*"),
    SAFETY("*Note: Results may vary. These are suggestions based on patterns, not guaranteed outcomes.*");

    private final String text;

    DisclaimerType(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /** The disclaimer as appended to a response, separated by a blank line. */
    public String block() {
        return "\n\n" + text;
    }
}
