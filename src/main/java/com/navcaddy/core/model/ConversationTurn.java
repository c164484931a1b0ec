package com.navcaddy.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One side of a conversational exchange.
 */
public record ConversationTurn(
    Role role,
    String content,
    Instant timestamp
) implements Serializable {

    public enum Role { USER, ASSISTANT }

    public ConversationTurn {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ConversationTurn user(String content, Instant at) {
        return new ConversationTurn(Role.USER, content, at);
    }

    public static ConversationTurn assistant(String content, Instant at) {
        return new ConversationTurn(Role.ASSISTANT, content, at);
    }
}
