package com.ryuqq.resumable.adapter.file.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * JSON file helpers shared by the file stores.
 *
 * <p>Writes go to a temporary file in the target's directory, are forced to disk, and
 * then replace the target with an atomic rename followed by a sync of the directory. A reader therefore sees either the
 * previous document or the new one, never a partial write.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class JsonFiles {

    private static final Logger log = LoggerFactory.getLogger(JsonFiles.class);

    private JsonFiles() {
    }

    /**
     * Creates the ObjectMapper used for checkpoint and result documents.
     *
     * <p>Instants are written as ISO-8601 strings and unknown properties are ignored,
     * so files carrying extra fields still load.</p>
     *
     * @return a configured ObjectMapper
     */
    static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes a value and atomically replaces the target file with it.
     *
     * @param mapper the ObjectMapper
     * @param target the file to replace
     * @param value the value to write
     * @throws IOException if the temporary file cannot be written or moved
     */
    static void writeAtomically(ObjectMapper mapper, Path target, Object value) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(value);
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);

        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            move(temp, target);
            syncDirectory(directory);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Forces the directory entry so the rename itself is durable.
     *
     * <p>Some platforms cannot open a directory as a channel. The write has already
     * replaced the target at that point, so the failure is logged and the write stands.</p>
     */
    private static void syncDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.debug("Directory sync not supported for {}: {}", directory, e.toString());
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to a plain replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
