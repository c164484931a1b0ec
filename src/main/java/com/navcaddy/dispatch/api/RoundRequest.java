package com.navcaddy.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for PUT /api/v1/sessions/{id}/round.
 *
 * @param roundId    round identifier
 * @param courseName course being played
 * @param hole       current hole; nullable, defaults to 1
 * @param par        par of the current hole; nullable, defaults to 4
 */
public record RoundRequest(
    @JsonProperty("round_id") String roundId,
    @JsonProperty("course_name") String courseName,
    Integer hole,
    Integer par
) {}
