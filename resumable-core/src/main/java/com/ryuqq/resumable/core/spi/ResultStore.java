package com.ryuqq.resumable.core.spi;

import com.ryuqq.resumable.core.outcome.Outcome;

import java.util.List;
import java.util.Set;

/**
 * Durable, append-only storage SPI for per-item {@link Outcome}s.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Idempotent append: an outcome whose id is already stored is skipped, as is a second
 *       outcome for the same id within one batch</li>
 *   <li>Durability: when {@link #append(List)} returns, the appended outcomes survive a crash</li>
 *   <li>Read access for status reporting and crash reconciliation</li>
 * </ul>
 *
 * <p><strong>Idempotency:</strong> calling {@link #append(List)} twice with the same outcomes
 * (for example after a crash between append and checkpoint update, followed by a retry)
 * must not duplicate entries. Deduplication is by identifier.</p>
 *
 * <p><strong>Concurrency Precondition:</strong> single writer, as for {@link CheckpointStore}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ResultStore {

    /**
     * Durably appends outcomes, skipping ids that are already present.
     *
     * @param outcomes the outcomes to append (may be empty)
     * @return the number of outcomes actually appended
     * @throws IllegalArgumentException if outcomes is null or contains null
     * @throws StoreException if the outcomes cannot be durably written
     */
    int append(List<Outcome> outcomes);

    /**
     * Returns all stored outcomes in append order.
     *
     * @return an immutable snapshot of stored outcomes
     * @throws StoreException if stored outcomes cannot be read
     */
    List<Outcome> loadAll();

    /**
     * Returns the identifiers of all stored outcomes.
     *
     * @return an immutable set of ids
     * @throws StoreException if stored outcomes cannot be read
     */
    Set<String> ids();

    /**
     * Returns the number of stored outcomes.
     *
     * @return outcome count
     * @throws StoreException if stored outcomes cannot be read
     */
    int size();

    /**
     * Removes all stored outcomes.
     *
     * <p>Only called by an explicit operator reset.</p>
     *
     * @throws StoreException if stored outcomes cannot be removed
     */
    void clear();
}
