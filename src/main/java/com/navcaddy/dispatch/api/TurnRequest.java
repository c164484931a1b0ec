package com.navcaddy.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/sessions/{id}/turns.
 *
 * @param input     what the user said or typed; blank input yields an error outcome, not a 400
 * @param inputType TEXT or VOICE; nullable, defaults to TEXT
 */
public record TurnRequest(
    String input,
    @JsonProperty("input_type") String inputType
) {}
