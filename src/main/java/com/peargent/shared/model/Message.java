package com.peargent.shared.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the conversation history. {@code agent} is set only on assistant
 * messages produced by a pool turn.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
    Role role,
    String content,
    String agent,
    Instant timestamp
) {
    public Message {
        Objects.requireNonNull(role, "role");
        content = content != null ? content : "";
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static Message user(String content) {
        return new Message(Role.USER, content, null, null);
    }

    public static Message assistant(String content, String agent) {
        return new Message(Role.ASSISTANT, content, agent, null);
    }

    public static Message system(String content) {
        return new Message(Role.SYSTEM, content, null, null);
    }
}
