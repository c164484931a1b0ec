package com.navcaddy.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * JSON view of a session's conversational context.
 *
 * @param summary one-line summary
 * @param prompt  the context block sent to the language model
 * @param hints   key/value hints for the UI
 */
public record ContextResponse(
    @JsonProperty("session_id") String sessionId,
    String summary,
    String prompt,
    Map<String, String> hints
) {}
