package com.navcaddy.core.llm;

/**
 * Thrown when a model reply cannot be read as a valid classification: bad JSON, a missing or
 * unknown {@code intent_type}, or a confidence outside [0, 1].
 */
public class LlmParseException extends RuntimeException {

    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
