package com.overseer.core.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes and reads {@link OverseerSnapshot}s as JSON files.
 * <p>
 * Writes go to a sibling temp file first and are moved into place, so a reader never sees
 * a partially written snapshot.
 */
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final ObjectMapper objectMapper;

    public SnapshotStore() {
        this(defaultObjectMapper());
    }

    public SnapshotStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(Path path, OverseerSnapshot snapshot) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Wrote snapshot of Overseer {} ({} requests, {} messages) to {}",
                    snapshot.overseerId(), snapshot.requests().size(), snapshot.messages().size(), path);
        } catch (IOException e) {
            throw new SnapshotException("Failed to write snapshot to " + path, e);
        }
    }

    public OverseerSnapshot read(Path path) {
        if (!Files.exists(path)) {
            throw new SnapshotException("Snapshot not found: " + path);
        }
        try {
            return objectMapper.readValue(path.toFile(), OverseerSnapshot.class);
        } catch (IOException e) {
            throw new SnapshotException("Failed to read snapshot from " + path, e);
        }
    }

    public String toJson(OverseerSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to serialize snapshot", e);
        }
    }
}
