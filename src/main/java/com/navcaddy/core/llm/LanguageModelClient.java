package com.navcaddy.core.llm;

/**
 * Black-box language model. Implementations perform one blocking network call and return the raw reply text.
 * <p>
 * Implementations may throw any runtime exception; callers categorise failures through
 * {@link com.navcaddy.core.error.NavCaddyError#fromThrowable(Throwable)}.
 */
@FunctionalInterface
public interface LanguageModelClient {

    String complete(LanguageModelRequest request);
}
