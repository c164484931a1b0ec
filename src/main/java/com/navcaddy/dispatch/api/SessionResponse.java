package com.navcaddy.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionResponse(@JsonProperty("session_id") String sessionId) {}
