package com.ryuqq.resumable.adapter.inmemory.store;

import com.ryuqq.resumable.core.model.Checkpoint;
import com.ryuqq.resumable.core.spi.CheckpointStore;

import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link CheckpointStore} for testing and reference purposes.
 *
 * <p>The checkpoint is an immutable value held in an {@link AtomicReference}, so
 * {@link #update(Checkpoint)} replaces it atomically and a concurrent {@link #load()}
 * sees either the old or the new checkpoint, never a mix.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final AtomicReference<Checkpoint> current = new AtomicReference<>(Checkpoint.empty());

    @Override
    public Checkpoint load() {
        return current.get();
    }

    @Override
    public void update(Checkpoint checkpoint) {
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint cannot be null");
        }
        current.set(checkpoint);
    }

    @Override
    public void clear() {
        current.set(Checkpoint.empty());
    }
}
