package com.navcaddy.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/suggestions.
 */
public record SuggestionRequest(@JsonProperty("intent_type") String intentType) {}
