package com.ryuqq.resumable.adapter.file.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.resumable.core.model.Checkpoint;
import com.ryuqq.resumable.core.spi.CheckpointStore;
import com.ryuqq.resumable.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link CheckpointStore} backed by a single JSON file.
 *
 * <p>A missing file means nothing has been processed. A file that exists but cannot be
 * parsed is reported as a {@link StoreException} and is never silently reset, since
 * resetting would restart the job from the beginning.</p>
 *
 * <p><strong>Durability:</strong> every update rewrites the whole document through a
 * temporary file and an atomic rename, so a crash leaves the previous checkpoint intact.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonFileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileCheckpointStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;

    /**
     * Creates a store over the given file. The file does not need to exist yet.
     *
     * @param file the checkpoint file
     * @throws IllegalArgumentException if file is null
     */
    public JsonFileCheckpointStore(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        this.file = file;
        this.objectMapper = JsonFiles.newObjectMapper();
    }

    @Override
    public synchronized Checkpoint load() {
        if (!Files.exists(file)) {
            return Checkpoint.empty();
        }
        try {
            CheckpointDocument document = objectMapper.readValue(file.toFile(), CheckpointDocument.class);
            if (document == null) {
                throw new StoreException("Checkpoint file is empty: " + file);
            }
            return document.toCheckpoint();
        } catch (IOException e) {
            throw new StoreException("Failed to read checkpoint file: " + file, e);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Corrupt checkpoint file " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void update(Checkpoint checkpoint) {
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint cannot be null");
        }
        try {
            JsonFiles.writeAtomically(objectMapper, file, CheckpointDocument.from(checkpoint));
            log.debug("Checkpoint written to {}: lastIndex={}, processed={}",
                file, checkpoint.lastIndex(), checkpoint.processedCount());
        } catch (IOException e) {
            throw new StoreException("Failed to write checkpoint file: " + file, e);
        }
    }

    @Override
    public synchronized void clear() {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Checkpoint file deleted: {}", file);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to delete checkpoint file: " + file, e);
        }
    }

    /**
     * Returns the backing file.
     *
     * @return the checkpoint file path
     */
    public Path file() {
        return file;
    }
}
