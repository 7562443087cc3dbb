package com.ryuqq.resumable.adapter.inmemory.store;

import com.ryuqq.resumable.core.spi.CheckpointStore;
import com.ryuqq.resumable.core.spi.ResultStore;
import com.ryuqq.resumable.testkit.contract.ResumeContractTest;

/**
 * Runs the resume contract against the in-memory stores.
 *
 * <p>The same store instances are returned on every call, so a restart keeps the state.</p>
 */
class InMemoryResumeContractTest extends ResumeContractTest {

    private final InMemoryCheckpointStore checkpoints = new InMemoryCheckpointStore();
    private final InMemoryResultStore results = new InMemoryResultStore();

    @Override
    protected CheckpointStore createCheckpointStore() {
        return checkpoints;
    }

    @Override
    protected ResultStore createResultStore() {
        return results;
    }
}
