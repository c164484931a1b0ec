package com.navcaddy.core.llm;

/**
 * Thrown when the language model returns null or blank content instead of a classification.
 */
public class LlmEmptyResponseException extends RuntimeException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
