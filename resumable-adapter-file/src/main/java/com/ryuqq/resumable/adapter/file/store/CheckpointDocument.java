package com.ryuqq.resumable.adapter.file.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.resumable.core.model.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * On-disk layout of the checkpoint file.
 *
 * <pre>
 * { "last_index": 99, "processed_urls": ["...", "..."], "timestamp": "2024-05-01T10:15:30Z" }
 * </pre>
 *
 * <p>The timestamp is informational. Besides ISO-8601 instants it accepts local date-times
 * such as {@code 2024-05-01 10:15:30}, read in the system time zone. Anything else loads
 * as no timestamp.</p>
 *
 * @param lastIndex highest accounted ledger position, -1 for none
 * @param processedUrls every accounted identifier
 * @param timestamp time of the last update
 */
record CheckpointDocument(
    @JsonProperty("last_index") Integer lastIndex,
    @JsonProperty("processed_urls") List<String> processedUrls,
    @JsonProperty("timestamp") String timestamp
) {

    private static final Logger log = LoggerFactory.getLogger(CheckpointDocument.class);

    // 2024-05-01T10:15:30Z, 2024-05-01T10:15:30.123+09:00, 2024-05-01 10:15:30
    private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
        .append(DateTimeFormatter.ISO_LOCAL_DATE)
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart().appendLiteral(' ').optionalEnd()
        .append(DateTimeFormatter.ISO_LOCAL_TIME)
        .optionalStart().appendOffsetId().optionalEnd()
        .toFormatter();

    static CheckpointDocument from(Checkpoint checkpoint) {
        return new CheckpointDocument(
            checkpoint.lastIndex(),
            new ArrayList<>(checkpoint.processedIds()),
            checkpoint.updatedAt() == null ? null : checkpoint.updatedAt().toString()
        );
    }

    /**
     * Converts back to the domain checkpoint.
     *
     * @return the checkpoint
     * @throws IllegalArgumentException if the document is missing last_index or holds invalid values
     */
    Checkpoint toCheckpoint() {
        if (lastIndex == null) {
            throw new IllegalArgumentException("last_index is missing");
        }
        List<String> ids = processedUrls == null ? List.of() : processedUrls;
        return new Checkpoint(lastIndex, new LinkedHashSet<>(ids), parseTimestamp(timestamp));
    }

    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            TemporalAccessor parsed = TIMESTAMP.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).atZone(ZoneId.systemDefault()).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Unreadable checkpoint timestamp '{}', loading without one", text);
            return null;
        }
    }
}
