package com.navcaddy.core.error;

/**
 * User-facing text for each failure category, written in the caddy's voice.
 */
public final class ErrorMessages {

    public static final String INPUT_EMPTY = "Please say or type something.";
    public static final String CLASSIFICATION_FAILED = "Sorry, classification failed. Let's give that another try.";
    public static final String NETWORK =
            "I'm having trouble connecting right now. Check your connection and let's try again.";
    public static final String TIMEOUT =
            "That's taking longer than expected. Let's try again, or I can show you some quick options.";
    public static final String NO_ACTIVE_ROUND =
            "You need to start a round first. Would you like to start a new round now?";
    public static final String UNKNOWN = "Something went wrong on my end. Let's try that again.";

    private ErrorMessages() {}

    /**
     * Message for a classification-stage failure. Model failures share one message so the user sees
     * the same thing whether the reply was late or malformed; the difference only shows up in logs.
     */
    public static String forClassification(ErrorKind kind) {
        return switch (kind) {
            case INPUT_EMPTY -> INPUT_EMPTY;
            case NO_ACTIVE_SESSION -> NO_ACTIVE_ROUND;
            case CLASSIFICATION_TIMEOUT, CLASSIFICATION_NETWORK_FAILURE, INVALID_MODEL_RESPONSE,
                 VALIDATION_ERROR, UNKNOWN -> CLASSIFICATION_FAILED;
        };
    }

    /**
     * Message for a failure outside classification, e.g. when generating a follow-up response.
     */
    public static String forResponse(ErrorKind kind) {
        return switch (kind) {
            case CLASSIFICATION_TIMEOUT -> TIMEOUT;
            case CLASSIFICATION_NETWORK_FAILURE -> NETWORK;
            case INPUT_EMPTY -> INPUT_EMPTY;
            case NO_ACTIVE_SESSION -> NO_ACTIVE_ROUND;
            case INVALID_MODEL_RESPONSE, VALIDATION_ERROR, UNKNOWN -> UNKNOWN;
        };
    }
}
