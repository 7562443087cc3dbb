package com.ryuqq.resumable.testkit.contract;

import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.spi.ResultStore;
import com.ryuqq.resumable.core.spi.StoreException;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ResultStore decorator that records append batch sizes and can fail appends.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FaultInjectingResultStore implements ResultStore {

    private final ResultStore delegate;
    private final List<Integer> batchSizes = new CopyOnWriteArrayList<>();
    private volatile int remainingAppends = Integer.MAX_VALUE;

    public FaultInjectingResultStore(ResultStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    /**
     * Lets the next {@code successfulAppends} appends through, then fails every append.
     *
     * @param successfulAppends appends to allow before failing
     * @return this store
     */
    public FaultInjectingResultStore failAfter(int successfulAppends) {
        this.remainingAppends = successfulAppends;
        return this;
    }

    @Override
    public int append(List<Outcome> outcomes) {
        if (remainingAppends <= 0) {
            throw new StoreException("Injected result write failure for " + outcomes.size() + " outcome(s)");
        }
        remainingAppends--;
        int appended = delegate.append(outcomes);
        batchSizes.add(outcomes.size());
        return appended;
    }

    @Override
    public List<Outcome> loadAll() {
        return delegate.loadAll();
    }

    @Override
    public Set<String> ids() {
        return delegate.ids();
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public void clear() {
        delegate.clear();
    }

    /**
     * Returns the size of every successful append batch, in order.
     *
     * @return the batch sizes
     */
    public List<Integer> batchSizes() {
        return Collections.unmodifiableList(batchSizes);
    }
}
