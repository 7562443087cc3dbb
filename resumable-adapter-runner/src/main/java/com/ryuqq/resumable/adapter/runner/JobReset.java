package com.ryuqq.resumable.adapter.runner;

import com.ryuqq.resumable.core.spi.CheckpointStore;
import com.ryuqq.resumable.core.spi.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 작업을 처음부터 다시 시작하도록 저장소를 비우는 운영자 작업.
 *
 * <p>Checkpoint를 먼저 비우고 그다음 Result Store를 비웁니다. 중간에 실패하면
 * Result Store가 남아 있어 다음 실행이 기존 결과를 건너뛰므로, 예외가 나면
 * reset을 다시 호출해야 합니다.</p>
 *
 * <p>Orchestrator가 실행 중일 때 호출하면 안 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobReset {

    private static final Logger log = LoggerFactory.getLogger(JobReset.class);

    private final CheckpointStore checkpointStore;
    private final ResultStore resultStore;

    /**
     * 생성자.
     *
     * @param checkpointStore 비울 Checkpoint 저장소
     * @param resultStore 비울 Result 저장소
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public JobReset(CheckpointStore checkpointStore, ResultStore resultStore) {
        if (checkpointStore == null) {
            throw new IllegalArgumentException("checkpointStore cannot be null");
        }
        if (resultStore == null) {
            throw new IllegalArgumentException("resultStore cannot be null");
        }
        this.checkpointStore = checkpointStore;
        this.resultStore = resultStore;
    }

    /**
     * 두 저장소를 비움.
     *
     * @throws com.ryuqq.resumable.core.spi.StoreException 저장소를 비우지 못한 경우
     */
    public void reset() {
        int discarded = resultStore.size();
        checkpointStore.clear();
        resultStore.clear();
        log.info("Job reset: checkpoint cleared, {} stored outcome(s) discarded", discarded);
    }
}
