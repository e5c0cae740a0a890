package com.arbiter.core.value;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link ValueMemoryStore} backed by a single JSON file.
 * <p>
 * Keys are snake_case and timestamps ISO-8601, so the file reads as
 * {@code {version, last_updated, global_value_function, alignment_history, drift_events}}.
 * Writes go to a sibling temp file that is then moved over the target.
 */
public class JsonFileValueMemoryStore implements ValueMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileValueMemoryStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileValueMemoryStore(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Optional<ValueMemorySnapshot> load() {
        if (!Files.exists(file)) {
            log.debug("No value memory at {}", file);
            return Optional.empty();
        }
        try {
            var snapshot = objectMapper.readValue(file.toFile(), ValueMemorySnapshot.class);
            if (snapshot == null || snapshot.globalValueFunction() == null) {
                throw new ValueMemoryStoreException("Value memory at " + file + " has no global_value_function");
            }
            return Optional.of(snapshot);
        } catch (IOException | IllegalArgumentException e) {
            throw new ValueMemoryStoreException("Failed to read value memory from " + file, e);
        }
    }

    @Override
    public void save(ValueMemorySnapshot snapshot) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ValueMemoryStoreException("Failed to write value memory to " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}
