package com.example.persession.services;

import com.example.persession.config.JacksonConfig;
import com.example.persession.models.SessionState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;

/**
 * Reads and writes session snapshots.
 *
 * The store knows nothing about HTTP. Every {@link #write} replaces the file even
 * if the content has not changed: the file's modification time is what
 * {@link CachePolicy} uses to decide whether a cache is still fresh.
 */
public class SessionCacheStore {
    private static final Logger log = LoggerFactory.getLogger(SessionCacheStore.class);

    private final ObjectMapper objectMapper;

    public SessionCacheStore() {
        this(JacksonConfig.cacheObjectMapper());
    }

    public SessionCacheStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Outcome of reading a cache file.
     */
    public enum Outcome {
        LOADED,
        NOT_FOUND,
        CORRUPT
    }

    public static final class ReadResult {
        private final Outcome outcome;
        private final SessionState state;

        private ReadResult(Outcome outcome, SessionState state) {
            this.outcome = outcome;
            this.state = state;
        }

        public Outcome getOutcome() {
            return outcome;
        }

        /**
         * @return the validated snapshot, or null unless the outcome is LOADED
         */
        public SessionState getState() {
            return state;
        }
    }

    /**
     * Writes the snapshot to {@code path}, replacing any existing file.
     *
     * @throws SessionCacheException if the file could not be written
     */
    public void write(Path path, SessionState state) {
        state.setSchemaVersion(SessionState.SCHEMA_VERSION);
        state.setSavedAt(Instant.now());

        Path directory = path.toAbsolutePath().getParent();
        Path tempFile = null;
        try {
            tempFile = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tempFile)) {
                objectMapper.writeValue(out, state);
            }
            moveIntoPlace(tempFile, path);
            log.debug("Session cache written to {}", path);
        } catch (IOException e) {
            deleteQuietly(tempFile);
            log.error("Failed to write session cache {}: {}", path, e.getMessage());
            throw new SessionCacheException(path, e);
        }
    }

    /**
     * Reads and validates the snapshot at {@code path}. Never throws: unreadable,
     * malformed or invalid files are reported as {@link Outcome#CORRUPT}.
     */
    public ReadResult read(Path path) {
        if (!Files.exists(path)) {
            return new ReadResult(Outcome.NOT_FOUND, null);
        }
        try {
            // A freshly allocated temporary file is empty
            if (Files.size(path) == 0) {
                log.debug("Cache file {} is empty", path);
                return new ReadResult(Outcome.NOT_FOUND, null);
            }
            SessionState state = objectMapper.readValue(path.toFile(), SessionState.class);
            if (state == null) {
                log.debug("Cache file {} holds no session state", path);
                return new ReadResult(Outcome.CORRUPT, null);
            }
            state.validate();
            return new ReadResult(Outcome.LOADED, state);
        } catch (IOException | IllegalStateException e) {
            log.debug("Cache file {} rejected: {}", path, e.getMessage());
            return new ReadResult(Outcome.CORRUPT, null);
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path tempFile) {
        if (tempFile == null) {
            return;
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Could not delete temporary cache file {}: {}", tempFile, e.getMessage());
        }
    }
}
