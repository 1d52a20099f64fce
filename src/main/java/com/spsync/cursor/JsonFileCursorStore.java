package com.spsync.cursor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.spsync.runtime.AtomicFileWriter;

/**
 * Keeps the cursor in a single JSON record, {@code {"token": ..., "updated_at": ...}}. Saves replace
 * the file atomically so a crash never leaves a half-written cursor behind.
 */
public class JsonFileCursorStore implements CursorStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileCursorStore.class);

    private final Path path;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public JsonFileCursorStore(Path path) {
        this.path = path;
    }

    @Override
    public Optional<SyncCursor> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            SyncCursor cursor = mapper.readValue(path.toFile(), SyncCursor.class);
            return Optional.ofNullable(cursor);
        } catch (IOException e) {
            log.warn("cursor.load.unreadable path={} reason={}", path, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(SyncCursor cursor) throws StorageException {
        try {
            AtomicFileWriter.write(path, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(cursor));
            log.debug("cursor.saved path={} cursor={}", path, cursor);
        } catch (IOException e) {
            throw new StorageException("Unable to persist sync cursor to " + path, e);
        }
    }

    @Override
    public void clear() throws StorageException {
        try {
            if (Files.deleteIfExists(path)) {
                log.info("cursor.cleared path={}", path);
            }
        } catch (IOException e) {
            throw new StorageException("Unable to discard sync cursor at " + path, e);
        }
    }

    public Path path() {
        return path;
    }
}
