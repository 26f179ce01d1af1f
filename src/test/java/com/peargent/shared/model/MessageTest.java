package com.peargent.shared.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void factoriesSetRoleAndAgent() {
        assertNull(Message.user("q").agent());
        assertEquals("Writer", Message.assistant("a", "Writer").agent());
        assertEquals(Role.SYSTEM, Message.system("s").role());
        assertEquals("", new Message(Role.USER, null, null, null).content());
        assertNotNull(Message.user("q").timestamp());
    }

    @Test
    void serializesWithLowercaseRoleAndWithoutNullAgent() throws Exception {
        var message = new Message(Role.USER, "hi", null, Instant.parse("2026-02-20T00:00:00Z"));

        var json = mapper.writeValueAsString(message);

        assertThat(json).contains("\"role\":\"user\"").doesNotContain("agent");
        assertEquals(message, mapper.readValue(json, Message.class));
    }
}
