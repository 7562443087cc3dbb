package com.ryuqq.resumable.testkit.contract;

import com.ryuqq.resumable.core.model.Checkpoint;
import com.ryuqq.resumable.core.spi.CheckpointStore;
import com.ryuqq.resumable.core.spi.StoreException;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * CheckpointStore decorator that records updates and can simulate a crash.
 *
 * <p>After {@link #failAfter(int)} successful updates every further update throws
 * {@link StoreException} without reaching the delegate, which is what a process
 * crash between the result append and the checkpoint write looks like to the store.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FaultInjectingCheckpointStore implements CheckpointStore {

    private final CheckpointStore delegate;
    private final List<Integer> updatedIndexes = new CopyOnWriteArrayList<>();
    private volatile int remainingUpdates = Integer.MAX_VALUE;

    public FaultInjectingCheckpointStore(CheckpointStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    /**
     * Lets the next {@code successfulUpdates} updates through, then fails every update.
     *
     * @param successfulUpdates updates to allow before failing
     * @return this store
     */
    public FaultInjectingCheckpointStore failAfter(int successfulUpdates) {
        this.remainingUpdates = successfulUpdates;
        return this;
    }

    @Override
    public Checkpoint load() {
        return delegate.load();
    }

    @Override
    public void update(Checkpoint checkpoint) {
        if (remainingUpdates <= 0) {
            throw new StoreException("Injected checkpoint write failure at lastIndex=" + checkpoint.lastIndex());
        }
        remainingUpdates--;
        delegate.update(checkpoint);
        updatedIndexes.add(checkpoint.lastIndex());
    }

    @Override
    public void clear() {
        delegate.clear();
    }

    /**
     * Returns the lastIndex of every successful update, in order.
     *
     * @return the updated indexes
     */
    public List<Integer> updatedIndexes() {
        return Collections.unmodifiableList(updatedIndexes);
    }
}
