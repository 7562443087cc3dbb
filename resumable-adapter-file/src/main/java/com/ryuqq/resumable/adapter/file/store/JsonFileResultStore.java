package com.ryuqq.resumable.adapter.file.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.spi.ResultStore;
import com.ryuqq.resumable.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link ResultStore} backed by a JSON array file.
 *
 * <p>The file is the only state: every call reads it, and every append that adds at least
 * one new identifier rewrites it through a temporary file and an atomic rename. An append
 * whose identifiers are all present already leaves the file untouched.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonFileResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileResultStore.class);

    private static final TypeReference<List<OutcomeDocument>> DOCUMENTS = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    /**
     * Creates a store over the given file. The file does not need to exist yet.
     *
     * @param file the result file
     * @throws IllegalArgumentException if file is null
     */
    public JsonFileResultStore(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        this.file = file;
        this.objectMapper = JsonFiles.newObjectMapper();
    }

    @Override
    public synchronized int append(List<Outcome> outcomes) {
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        if (outcomes.isEmpty()) {
            return 0;
        }

        Map<String, Outcome> stored = read();
        int appended = 0;
        for (Outcome outcome : outcomes) {
            if (stored.putIfAbsent(outcome.id(), outcome) == null) {
                appended++;
            }
        }
        if (appended == 0) {
            log.debug("All {} outcome(s) already stored in {}, nothing written", outcomes.size(), file);
            return 0;
        }

        List<OutcomeDocument> documents = new ArrayList<>(stored.size());
        for (Outcome outcome : stored.values()) {
            documents.add(OutcomeDocument.from(outcome));
        }
        try {
            JsonFiles.writeAtomically(objectMapper, file, documents);
        } catch (IOException e) {
            throw new StoreException("Failed to write result file: " + file, e);
        }
        log.debug("Appended {} outcome(s) to {} (total {})", appended, file, stored.size());
        return appended;
    }

    @Override
    public synchronized List<Outcome> loadAll() {
        return List.copyOf(read().values());
    }

    @Override
    public synchronized Set<String> ids() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(read().keySet()));
    }

    @Override
    public synchronized int size() {
        return read().size();
    }

    @Override
    public synchronized void clear() {
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Result file deleted: {}", file);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to delete result file: " + file, e);
        }
    }

    /**
     * Returns the backing file.
     *
     * @return the result file path
     */
    public Path file() {
        return file;
    }

    private Map<String, Outcome> read() {
        Map<String, Outcome> stored = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return stored;
        }
        List<OutcomeDocument> documents;
        Instant fileModifiedAt;
        try {
            documents = objectMapper.readValue(file.toFile(), DOCUMENTS);
            fileModifiedAt = Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            throw new StoreException("Failed to read result file: " + file, e);
        }
        if (documents == null) {
            return stored;
        }
        for (OutcomeDocument document : documents) {
            try {
                Outcome outcome = document.toOutcome(fileModifiedAt);
                stored.putIfAbsent(outcome.id(), outcome);
            } catch (IllegalArgumentException e) {
                throw new StoreException("Corrupt entry in result file " + file + ": " + e.getMessage(), e);
            }
        }
        return stored;
    }
}
