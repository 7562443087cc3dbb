package com.ryuqq.resumable.core.spi;

import com.ryuqq.resumable.core.model.Checkpoint;

/**
 * Durable storage SPI for the job {@link Checkpoint}.
 *
 * <p>The checkpoint records the highest fully-accounted ledger index and the set of
 * identifiers already processed. It is the only resume point after an uncontrolled
 * termination.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Return the last durably written checkpoint, or {@link Checkpoint#empty()} on first use</li>
 *   <li>Replace the checkpoint atomically: a subsequent {@link #load()} sees either the old
 *       or the new checkpoint, never a partially written one</li>
 *   <li>Clear the checkpoint when an operator explicitly resets the job</li>
 * </ul>
 *
 * <p><strong>Ordering (enforced by the orchestrator):</strong></p>
 * <pre>
 * 1. resultStore.append(outcomes)    → outcomes durable
 * 2. checkpointStore.update(next)    → checkpoint advanced past their indices
 * </pre>
 * <p>The converse order is forbidden: a crash after advancing but before appending would
 * silently skip those items on resume.</p>
 *
 * <p><strong>Concurrency Precondition:</strong> at most one run writes to a given store
 * at a time. Where concurrent runs cannot be ruled out by the launcher, the deployment must
 * pair this store with an external mutual-exclusion mechanism such as a lease.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CheckpointStore {

    /**
     * Loads the current checkpoint.
     *
     * @return the stored checkpoint, or {@link Checkpoint#empty()} if none has been written
     * @throws StoreException if a stored checkpoint exists but cannot be read
     */
    Checkpoint load();

    /**
     * Durably and atomically replaces the stored checkpoint.
     *
     * <p>Implementations backed by files write to a temporary location and then
     * atomically rename it over the previous checkpoint.</p>
     *
     * @param checkpoint the new checkpoint
     * @throws IllegalArgumentException if checkpoint is null
     * @throws StoreException if the checkpoint cannot be durably written
     */
    void update(Checkpoint checkpoint);

    /**
     * Removes the stored checkpoint so the next {@link #load()} returns an empty one.
     *
     * <p>Only called by an explicit operator reset; the engine never resets on its own.</p>
     *
     * @throws StoreException if the checkpoint cannot be removed
     */
    void clear();
}
