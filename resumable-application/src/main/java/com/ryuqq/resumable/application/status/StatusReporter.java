package com.ryuqq.resumable.application.status;

import com.ryuqq.resumable.core.spi.CheckpointStore;
import com.ryuqq.resumable.core.spi.ResultStore;

/**
 * Read-only progress query over the Checkpoint Store and Result Store.
 *
 * <p>Suitable for periodic polling by an operator or a dashboard. It never mutates
 * either store and never blocks a running orchestrator beyond the stores' own reads.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StatusReporter {

    /**
     * Computes the current progress snapshot.
     *
     * @param checkpointStore the job's checkpoint store
     * @param resultStore the job's result store
     * @param ledgerSize number of items in the Work Ledger
     * @return the progress snapshot
     * @throws IllegalArgumentException if a store is null or ledgerSize is negative
     * @throws com.ryuqq.resumable.core.spi.StoreException if persisted state cannot be read
     */
    ProgressSnapshot report(CheckpointStore checkpointStore, ResultStore resultStore, int ledgerSize);
}
