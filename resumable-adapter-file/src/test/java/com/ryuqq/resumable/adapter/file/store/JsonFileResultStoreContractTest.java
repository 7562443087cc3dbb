package com.ryuqq.resumable.adapter.file.store;

import com.ryuqq.resumable.core.spi.CheckpointStore;
import com.ryuqq.resumable.core.spi.ResultStore;
import com.ryuqq.resumable.testkit.contract.ResultStoreContractTest;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

/**
 * Runs the ResultStore contract against the JSON file stores.
 *
 * <p>Each factory call opens a new store over the same files, so a restart rereads from disk.</p>
 */
class JsonFileResultStoreContractTest extends ResultStoreContractTest {

    @TempDir
    Path directory;

    @Override
    protected CheckpointStore createCheckpointStore() {
        return new JsonFileCheckpointStore(directory.resolve("checkpoint.json"));
    }

    @Override
    protected ResultStore createResultStore() {
        return new JsonFileResultStore(directory.resolve("results.json"));
    }
}
