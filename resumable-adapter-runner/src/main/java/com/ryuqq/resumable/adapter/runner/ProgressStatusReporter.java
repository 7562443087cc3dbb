package com.ryuqq.resumable.adapter.runner;

import com.ryuqq.resumable.application.status.ProgressSnapshot;
import com.ryuqq.resumable.application.status.StatusReporter;
import com.ryuqq.resumable.core.model.Checkpoint;
import com.ryuqq.resumable.core.model.RunSlice;
import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.spi.CheckpointStore;
import com.ryuqq.resumable.core.spi.ResultStore;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 저장소 상태만으로 진행률을 계산하는 StatusReporter 구현체.
 *
 * <p><strong>계산 규칙:</strong></p>
 * <ul>
 *   <li>covered = min(lastIndex + 1, ledgerSize)</li>
 *   <li>remaining = ledgerSize - covered</li>
 *   <li>percentComplete = covered / ledgerSize × 100 (ledger가 비어있으면 100)</li>
 *   <li>estimatedRemainingRuns = ceil(remaining / maxItemsPerRun)</li>
 *   <li>processedCount = |checkpoint.processedIds ∪ resultStore ids|</li>
 *   <li>successRate = succeeded / 저장된 결과 수 × 100 (결과가 없으면 0)</li>
 * </ul>
 *
 * <p>저장소를 읽기만 하므로 실행 중인 Orchestrator와 동시에 호출해도 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ProgressStatusReporter implements StatusReporter {

    private final StatusReporterConfig config;

    /**
     * 기본 설정으로 생성.
     */
    public ProgressStatusReporter() {
        this(new StatusReporterConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ProgressStatusReporter(StatusReporterConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public ProgressSnapshot report(CheckpointStore checkpointStore, ResultStore resultStore, int ledgerSize) {
        if (checkpointStore == null) {
            throw new IllegalArgumentException("checkpointStore cannot be null");
        }
        if (resultStore == null) {
            throw new IllegalArgumentException("resultStore cannot be null");
        }
        if (ledgerSize < 0) {
            throw new IllegalArgumentException("ledgerSize must not be negative (current: " + ledgerSize + ")");
        }

        Checkpoint checkpoint = checkpointStore.load();
        List<Outcome> outcomes = resultStore.loadAll();

        int succeeded = 0;
        int failed = 0;
        Set<String> processed = new HashSet<>(checkpoint.processedIds());
        for (Outcome outcome : outcomes) {
            if (outcome.isSucceeded()) {
                succeeded++;
            } else {
                failed++;
            }
            processed.add(outcome.id());
        }

        int covered = Math.min(checkpoint.lastIndex() + 1, ledgerSize);
        int remaining = ledgerSize - covered;
        double percentComplete = ledgerSize == 0 ? 100.0 : covered * 100.0 / ledgerSize;
        int remainingRuns = (int) (((long) remaining + config.maxItemsPerRun() - 1) / config.maxItemsPerRun());
        double successRate = outcomes.isEmpty() ? 0.0 : succeeded * 100.0 / outcomes.size();

        RunSlice nextSlice = remaining == 0
            ? RunSlice.EMPTY
            : new RunSlice(covered, (int) Math.min((long) covered + config.maxItemsPerRun() - 1, ledgerSize - 1));

        Duration remainingTime = config.perRunEstimate() == null
            ? null
            : config.perRunEstimate().multipliedBy(remainingRuns);

        return new ProgressSnapshot(
            ledgerSize,
            processed.size(),
            succeeded,
            failed,
            remaining,
            percentComplete,
            remainingRuns,
            successRate,
            checkpoint.lastIndex(),
            checkpoint.updatedAt(),
            nextSlice,
            remainingTime
        );
    }
}
