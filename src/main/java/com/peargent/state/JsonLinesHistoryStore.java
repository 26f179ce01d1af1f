package com.peargent.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.peargent.shared.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * File-backed store, one JSON message per line. Survives process restarts, so a new
 * pool can continue an earlier conversation.
 */
public class JsonLinesHistoryStore implements HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesHistoryStore.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Path file;

    public JsonLinesHistoryStore(Path file) {
        this.file = file;
    }

    public Path file() { return file; }

    @Override
    public synchronized void append(Message message) {
        try {
            var parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, mapper.writeValueAsString(message) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to history file " + file, e);
        }
    }

    @Override
    public synchronized List<Message> load() {
        if (!Files.exists(file)) return List.of();
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read history file " + file, e);
        }
        var messages = new ArrayList<Message>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if (line.isBlank()) continue;
            try {
                messages.add(mapper.readValue(line, Message.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping corrupt history line {} in {}: {}", i + 1, file, e.getOriginalMessage());
            }
        }
        return List.copyOf(messages);
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear history file " + file, e);
        }
    }
}
