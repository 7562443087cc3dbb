package com.ryuqq.resumable.adapter.file.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.resumable.core.outcome.Failed;
import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.outcome.OutcomeStatus;
import com.ryuqq.resumable.core.outcome.Succeeded;

import java.time.Instant;
import java.util.Map;

/**
 * On-disk layout of one entry in the result file.
 *
 * <pre>
 * { "id": "...", "status": "succeeded", "payload": {...}, "error": null, "recorded_at": "..." }
 * </pre>
 *
 * <p>{@code recorded_at} is optional on read.</p>
 */
record OutcomeDocument(
    @JsonProperty("id") String id,
    @JsonProperty("status") String status,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("error") String error,
    @JsonProperty("recorded_at") Instant recordedAt
) {

    static OutcomeDocument from(Outcome outcome) {
        return new OutcomeDocument(
            outcome.id(),
            outcome.status().wireName(),
            outcome.payload(),
            outcome.error(),
            outcome.recordedAt()
        );
    }

    /**
     * Converts back to the domain outcome.
     *
     * <p>Files written without {@code recorded_at} load with the given fallback time.</p>
     *
     * @param fallbackRecordedAt time used when the entry carries no recorded_at
     * @return Succeeded or Failed
     * @throws IllegalArgumentException if the status is unknown or a required field is missing
     */
    Outcome toOutcome(Instant fallbackRecordedAt) {
        if (status == null) {
            throw new IllegalArgumentException("status is missing for id " + id);
        }
        Instant at = recordedAt == null ? fallbackRecordedAt : recordedAt;
        if (OutcomeStatus.fromWireName(status) == OutcomeStatus.SUCCEEDED) {
            return Succeeded.of(id, payload == null ? Map.of() : payload, at);
        }
        return Failed.of(id, error, at);
    }
}
