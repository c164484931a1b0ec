package com.navcaddy.core.routing;

import com.navcaddy.core.error.ErrorMessages;

/**
 * Session state a destination needs before it can be opened.
 */
public enum Prerequisite {
    ROUND_ACTIVE(ErrorMessages.NO_ACTIVE_ROUND),
    COURSE_SELECTED("I need to know which course you're playing. Would you like to start a new round now?");

    private final String message;

    Prerequisite(String message) {
        this.message = message;
    }

    /** What to tell the user when this prerequisite is missing. */
    public String message() {
        return message;
    }
}
