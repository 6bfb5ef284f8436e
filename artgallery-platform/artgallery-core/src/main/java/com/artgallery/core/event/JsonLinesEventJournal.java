package com.artgallery.core.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable copy of the event log: one JSON document per line, in sequence order.
 * Attach an instance to an {@link EventLog} so every commit is written here first.
 */
public class JsonLinesEventJournal implements EventJournal {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesEventJournal.class);

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonLinesEventJournal(Path path) {
        this(path, defaultObjectMapper());
    }

    public JsonLinesEventJournal(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Reads every journaled event; an absent file is an empty journal.
     */
    public List<RegistryEvent> load() {
        if (!Files.exists(path)) {
            return List.of();
        }
        List<RegistryEvent> events = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    events.add(objectMapper.readValue(line, RegistryEvent.class));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read event journal " + path, e);
        }
        log.info("Loaded {} events from journal {}", events.size(), path);
        return events;
    }

    @Override
    public synchronized void write(List<RegistryEvent> events) {
        try {
            StringBuilder lines = new StringBuilder();
            for (RegistryEvent event : events) {
                lines.append(objectMapper.writeValueAsString(event)).append(System.lineSeparator());
            }
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(lines.toString());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to journal events from sequence " + events.get(0).sequence()
                    + " to " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }
}
