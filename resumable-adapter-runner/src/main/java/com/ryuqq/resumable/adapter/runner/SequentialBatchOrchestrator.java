package com.ryuqq.resumable.adapter.runner;

import com.ryuqq.resumable.application.orchestrator.BatchConfig;
import com.ryuqq.resumable.application.orchestrator.BatchOrchestrator;
import com.ryuqq.resumable.application.orchestrator.RunReport;
import com.ryuqq.resumable.core.extraction.ExtractionOperation;
import com.ryuqq.resumable.core.extraction.ExtractionResult;
import com.ryuqq.resumable.core.model.Checkpoint;
import com.ryuqq.resumable.core.model.RunSlice;
import com.ryuqq.resumable.core.model.WorkItem;
import com.ryuqq.resumable.core.model.WorkLedger;
import com.ryuqq.resumable.core.outcome.Failed;
import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.spi.CheckpointStore;
import com.ryuqq.resumable.core.spi.ResultStore;
import com.ryuqq.resumable.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 순차 처리 Batch Orchestrator 구현체.
 *
 * <p>한 실행에서 구간의 항목을 하나씩 순서대로 추출하고, 결과를 주기적으로 flush합니다.
 * 실행 안에서는 병렬 추출을 하지 않으며, 처리량은 실행을 더 많이 연결해서 늘립니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runOnce() 호출
 *   ↓
 * checkpointStore.load() + resultStore.ids() 병합 (flush 후 Checkpoint 갱신 전 중단 복구)
 *   ↓
 * slice = ledger.sliceFrom(checkpoint, maxItemsPerRun)  → 비어있으면 완료 보고
 *   ↓
 * For i in slice:
 *   1. 처리된 식별자면 skip
 *   2. interItemDelay 대기 (첫 시도 제외)
 *   3. operation.extract(id) → Outcome (예외는 Failed로 변환)
 *   4. 버퍼 크기 ≥ flushEvery 또는 i == end:
 *      a. resultStore.append(buffer)      ← 반드시 먼저
 *      b. checkpointStore.update(lastIndex = i)
 *   ↓
 * RunReport(attempted, succeeded, failed, hasMoreWork)
 * </pre>
 *
 * <p><strong>상태:</strong> 필드는 모두 불변이며 실행 간 공유되는 가변 상태가 없습니다.
 * 진행 상태는 인자로 받은 저장소에만 존재합니다.</p>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>항목 추출 실패 → Failed 결과로 기록, 실행 계속</li>
 *   <li>저장소 쓰기 실패 → StoreException 전파, 실행 중단 (이전 Checkpoint 유지)</li>
 *   <li>인터럽트 → 현재 항목은 기록하지 않고 실행 중단 (다음 실행에서 다시 시도)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SequentialBatchOrchestrator implements BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SequentialBatchOrchestrator.class);

    private final ExtractionOperation operation;
    private final Clock clock;
    private final Pacer pacer;

    /**
     * 생성자 (시스템 시계, Thread.sleep 대기).
     *
     * @param operation 추출 작업
     * @throws IllegalArgumentException operation이 null인 경우
     */
    public SequentialBatchOrchestrator(ExtractionOperation operation) {
        this(operation, Clock.systemUTC(), Pacer.threadSleep());
    }

    /**
     * 생성자 (시계와 대기 전략 주입).
     *
     * @param operation 추출 작업
     * @param clock 기록 시각과 경과 시간 계산에 사용할 시계
     * @param pacer 항목 간 대기 전략
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SequentialBatchOrchestrator(ExtractionOperation operation, Clock clock, Pacer pacer) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (pacer == null) {
            throw new IllegalArgumentException("pacer cannot be null");
        }
        this.operation = operation;
        this.clock = clock;
        this.pacer = pacer;
    }

    @Override
    public RunReport runOnce(WorkLedger ledger, CheckpointStore checkpointStore,
                             ResultStore resultStore, BatchConfig config) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (checkpointStore == null) {
            throw new IllegalArgumentException("checkpointStore cannot be null");
        }
        if (resultStore == null) {
            throw new IllegalArgumentException("resultStore cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        Instant startedAt = clock.instant();

        // 1. Checkpoint 로드 및 Result Store와 병합
        Checkpoint checkpoint = reconcile(checkpointStore.load(), resultStore);
        RunSlice slice = ledger.sliceFrom(checkpoint, config.maxItemsPerRun());

        if (slice.isEmpty()) {
            log.info("All {} item(s) already processed (lastIndex={}), nothing to do",
                ledger.size(), checkpoint.lastIndex());
            return RunReport.jobComplete(checkpoint.lastIndex(), elapsedSince(startedAt));
        }

        log.info("Processing slice [{}..{}] of {} item(s): maxItemsPerRun={}, flushEvery={}, interItemDelay={}",
            slice.start(), slice.end(), ledger.size(),
            config.maxItemsPerRun(), config.flushEvery(), config.interItemDelay());

        // 2. 구간 순차 처리
        Set<String> processed = new HashSet<>(checkpoint.processedIds());
        List<Outcome> pending = new ArrayList<>();
        Set<String> accounted = new LinkedHashSet<>();
        int attempted = 0;
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int lastVisited = checkpoint.lastIndex();
        boolean stoppedEarly = false;

        for (int i = slice.start(); i <= slice.end(); i++) {
            if (i > slice.start() && budgetExhausted(startedAt, config)) {
                stoppedEarly = true;
                log.warn("Soft time budget {} reached after index {}, stopping early", config.softTimeBudget(), lastVisited);
                break;
            }

            WorkItem item = ledger.get(i);
            String position = "[" + (i + 1) + "/" + ledger.size() + "]";

            if (processed.contains(item.id())) {
                skipped++;
                log.info("{} Skipping (already processed): {}", position, item.id());
            } else {
                if (attempted > 0) {
                    pacer.pause(config.interItemDelay());
                }
                log.info("{} Processing: {}", position, item.id());
                Outcome outcome = extract(item);
                attempted++;
                if (outcome.isSucceeded()) {
                    succeeded++;
                    log.info("{} Success: {}", position, item.id());
                } else {
                    failed++;
                    log.warn("{} Failed: {} ({})", position, item.id(), outcome.error());
                }
                pending.add(outcome);
                processed.add(item.id());
            }
            accounted.add(item.id());
            lastVisited = i;

            // 3. flush: Result Store append → Checkpoint 갱신
            if (pending.size() >= config.flushEvery() || slice.isLast(i)) {
                checkpoint = flush(checkpointStore, resultStore, checkpoint, pending, accounted, i);
            }
        }

        if (stoppedEarly && lastVisited > checkpoint.lastIndex()) {
            checkpoint = flush(checkpointStore, resultStore, checkpoint, pending, accounted, lastVisited);
        }

        boolean hasMoreWork = checkpoint.lastIndex() < ledger.lastIndex();
        RunReport report = new RunReport(slice, attempted, succeeded, failed, skipped,
            checkpoint.lastIndex(), hasMoreWork, stoppedEarly, elapsedSince(startedAt));

        logSummary(report, ledger);
        return report;
    }

    /**
     * Result Store에는 기록되었지만 Checkpoint에 반영되지 않은 식별자를 병합.
     *
     * <p>flush 후 Checkpoint 갱신 전에 중단된 경우, 해당 항목을 다시 추출하지 않도록 합니다.
     * 병합 결과는 다음 flush 때 영속화됩니다.</p>
     */
    private Checkpoint reconcile(Checkpoint checkpoint, ResultStore resultStore) {
        Checkpoint merged = checkpoint.withProcessed(resultStore.ids());
        if (merged != checkpoint) {
            log.info("Recovered {} id(s) present in the result store but missing from the checkpoint",
                merged.processedCount() - checkpoint.processedCount());
        }
        return merged;
    }

    /**
     * 항목 하나 추출 (예외는 Failed로 변환).
     *
     * <p>InterruptedException은 실행 취소로 간주하여 인터럽트 플래그를 복원하고 전파합니다.
     * LinkageError는 실행 환경을 사용할 수 없는 경우로 보고 Failed로 변환합니다.</p>
     */
    private Outcome extract(WorkItem item) {
        try {
            ExtractionResult result = operation.extract(item.id());
            if (result == null) {
                return Failed.of(item.id(), "Extraction returned no result", clock.instant());
            }
            return result.toOutcome(item.id(), clock.instant());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Run interrupted while extracting " + item.id(), e);
        } catch (Exception e) {
            log.error("Extraction threw for {}", item.id(), e);
            return Failed.fromException(item.id(), e, clock.instant());
        } catch (LinkageError e) {
            // 브라우저 드라이버 등 런타임 환경 로딩 실패
            log.error("Extraction environment failed to load for {}", item.id(), e);
            return Failed.fromException(item.id(), e, clock.instant());
        }
    }

    /**
     * 버퍼를 Result Store에 append한 뒤 Checkpoint를 전진.
     *
     * <p>순서를 바꾸면 안 됩니다. Checkpoint를 먼저 전진시킨 뒤 중단되면
     * 결과가 기록되지 않은 항목이 다음 실행에서 건너뛰어집니다.</p>
     */
    private Checkpoint flush(CheckpointStore checkpointStore, ResultStore resultStore, Checkpoint current,
                             List<Outcome> pending, Set<String> accounted, int index) {
        try {
            int appended = resultStore.append(List.copyOf(pending));
            Checkpoint next = current.advance(index, accounted, clock.instant());
            checkpointStore.update(next);
            log.info("Flushed {} outcome(s) ({} new), checkpoint lastIndex={}, processed={}",
                pending.size(), appended, next.lastIndex(), next.processedCount());
            pending.clear();
            accounted.clear();
            return next;
        } catch (StoreException e) {
            log.error("Flush failed at index {}; checkpoint stays at lastIndex={}", index, current.lastIndex(), e);
            throw e;
        }
    }

    private boolean budgetExhausted(Instant startedAt, BatchConfig config) {
        return config.hasSoftTimeBudget()
            && elapsedSince(startedAt).compareTo(config.softTimeBudget()) >= 0;
    }

    private Duration elapsedSince(Instant startedAt) {
        return Duration.between(startedAt, clock.instant());
    }

    private void logSummary(RunReport report, WorkLedger ledger) {
        log.info("Run summary: attempted={}, succeeded={}, failed={}, skipped={}, elapsed={}",
            report.attempted(), report.succeeded(), report.failed(), report.skipped(), report.elapsed());
        int nextStart = report.lastIndex() + 1;
        if (report.hasMoreWork()) {
            log.info("Next start index: {}, remaining: {}", nextStart, ledger.size() - nextStart);
        } else {
            log.info("All {} item(s) have been processed", ledger.size());
        }
    }
}
