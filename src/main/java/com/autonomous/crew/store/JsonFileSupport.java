package com.autonomous.crew.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Whole-file JSON documents and append-only JSON lines, shared by the file-backed stores.
 */
@Slf4j
public class JsonFileSupport {

    private final ObjectMapper mapper;

    public JsonFileSupport() {
        this.mapper = newMapper();
    }

    public static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public <T> List<T> readList(Path file, TypeReference<List<T>> type) {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            List<T> values = mapper.readValue(file.toFile(), type);
            return values != null ? values : new ArrayList<>();
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            return new ArrayList<>();
        }
    }

    public <T> Optional<T> readValue(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /** Writes through a sibling temp file so readers never see a half-written document. */
    public void writeAtomically(Path file, Object value) throws IOException {
        Files.createDirectories(file.getParent());
        // unique per call
        Path temp = Files.createTempFile(file.getParent(), file.getFileName() + ".", ".tmp");
        try {
            mapper.writeValue(temp.toFile(), value);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    public void appendLine(Path file, Object value) throws IOException {
        Files.createDirectories(file.getParent());
        String json = mapper.writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsString(value);
        Files.writeString(file, json + "\n", StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    public <T> List<T> readLines(Path file, Class<T> type) {
        List<T> values = new ArrayList<>();
        if (!Files.exists(file)) {
            return values;
        }
        try {
            for (String line : Files.readAllLines(file)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    values.add(mapper.readValue(line, type));
                } catch (IOException e) {
                    log.warn("Skipping malformed line in {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
        }
        return values;
    }
}
