package com.ryuqq.resumable.application.status;

import com.ryuqq.resumable.core.model.RunSlice;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time progress of the whole job, computed from persisted state only.
 *
 * @param totalItems number of items in the Work Ledger
 * @param processedCount distinct identifiers accounted for (succeeded or failed)
 * @param succeededCount stored succeeded outcomes
 * @param failedCount stored failed outcomes
 * @param remainingCount ledger positions after the checkpoint's last index
 * @param percentComplete share of ledger positions covered by the checkpoint, 0–100
 * @param estimatedRemainingRuns {@code ceil(remainingCount / maxItemsPerRun)}
 * @param successRate succeeded share of stored outcomes, 0–100 (0 when nothing is stored)
 * @param lastIndex checkpoint last index (-1 when nothing has been accounted for)
 * @param lastUpdated checkpoint timestamp, or null when no checkpoint was written
 * @param nextSlice the slice the next run would attempt ({@link RunSlice#EMPTY} when complete)
 * @param estimatedRemainingTime remaining runs times the configured per-run estimate,
 *                               or null when no estimate is configured
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ProgressSnapshot(
    int totalItems,
    int processedCount,
    int succeededCount,
    int failedCount,
    int remainingCount,
    double percentComplete,
    int estimatedRemainingRuns,
    double successRate,
    int lastIndex,
    Instant lastUpdated,
    RunSlice nextSlice,
    Duration estimatedRemainingTime
) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException if a count is negative or nextSlice is null
     */
    public ProgressSnapshot {
        if (totalItems < 0 || processedCount < 0 || succeededCount < 0
            || failedCount < 0 || remainingCount < 0 || estimatedRemainingRuns < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        if (nextSlice == null) {
            throw new IllegalArgumentException("nextSlice cannot be null");
        }
    }

    /**
     * Whether every ledger position has been accounted for.
     *
     * @return true when nothing remains
     */
    public boolean isComplete() {
        return remainingCount == 0;
    }
}
