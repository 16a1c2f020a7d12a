package com.wickscan.execution.state;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
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
 * JSON file holding the last {@link EngineSnapshot}. Writes go to a temp file that is then moved
 * over the target, so a crash never leaves a half-written state.
 */
public class EngineStateStore {

    private static final Logger log = LoggerFactory.getLogger(EngineStateStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public EngineStateStore(Path file) {
        this.file = file;
        this.mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return false when the snapshot could not be written (logged)
     */
    public synchronized boolean save(EngineSnapshot snapshot) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved engine state: {} positions", snapshot.positions().size());
            return true;
        } catch (IOException e) {
            log.error("Failed to save engine state to {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Last saved snapshot, empty when there is none or it cannot be read.
     */
    public synchronized Optional<EngineSnapshot> load() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), EngineSnapshot.class));
        } catch (IOException e) {
            log.error("Failed to read engine state from {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
