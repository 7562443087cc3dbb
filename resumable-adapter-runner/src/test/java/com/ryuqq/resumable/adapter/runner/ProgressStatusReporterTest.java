package com.ryuqq.resumable.adapter.runner;

import com.ryuqq.resumable.application.status.ProgressSnapshot;
import com.ryuqq.resumable.core.model.Checkpoint;
import com.ryuqq.resumable.core.model.RunSlice;
import com.ryuqq.resumable.core.outcome.Failed;
import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.outcome.Succeeded;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * ProgressStatusReporter 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProgressStatusReporterTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private FakeCheckpointStore checkpointStore;
    private FakeResultStore resultStore;

    @BeforeEach
    void setUp() {
        checkpointStore = new FakeCheckpointStore();
        resultStore = new FakeResultStore();
    }

    private void recordFirstHundred(int failures) {
        Set<String> ids = new LinkedHashSet<>();
        List<Outcome> outcomes = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            String id = Ledgers.url(i);
            ids.add(id);
            outcomes.add(i < failures
                ? Failed.of(id, "Empty content", NOW)
                : Succeeded.of(id, Map.of("title", id), NOW));
        }
        resultStore.append(outcomes);
        checkpointStore.update(new Checkpoint(99, ids, NOW));
    }

    @Test
    void 첫_구간_처리_후_진행률과_남은_실행_횟수_계산() {
        // given
        recordFirstHundred(5);
        ProgressStatusReporter reporter = new ProgressStatusReporter(
            new StatusReporterConfig().withPerRunEstimate(Duration.ofMinutes(150)));

        // when
        ProgressSnapshot snapshot = reporter.report(checkpointStore, resultStore, 1163);

        // then
        assertThat(snapshot.totalItems()).isEqualTo(1163);
        assertThat(snapshot.processedCount()).isEqualTo(100);
        assertThat(snapshot.succeededCount()).isEqualTo(95);
        assertThat(snapshot.failedCount()).isEqualTo(5);
        assertThat(snapshot.remainingCount()).isEqualTo(1063);
        assertThat(snapshot.percentComplete()).isCloseTo(8.598, within(0.001));
        assertThat(snapshot.estimatedRemainingRuns()).isEqualTo(11);
        assertThat(snapshot.successRate()).isEqualTo(95.0);
        assertThat(snapshot.lastIndex()).isEqualTo(99);
        assertThat(snapshot.lastUpdated()).isEqualTo(NOW);
        assertThat(snapshot.nextSlice()).isEqualTo(new RunSlice(100, 199));
        assertThat(snapshot.estimatedRemainingTime()).isEqualTo(Duration.ofMinutes(150 * 11));
        assertThat(snapshot.isComplete()).isFalse();
    }

    @Test
    void 아무것도_처리되지_않았으면_0퍼센트와_첫_구간() {
        // when
        ProgressSnapshot snapshot = new ProgressStatusReporter().report(checkpointStore, resultStore, 250);

        // then
        assertThat(snapshot.percentComplete()).isZero();
        assertThat(snapshot.remainingCount()).isEqualTo(250);
        assertThat(snapshot.estimatedRemainingRuns()).isEqualTo(3);
        assertThat(snapshot.successRate()).isZero();
        assertThat(snapshot.lastIndex()).isEqualTo(-1);
        assertThat(snapshot.lastUpdated()).isNull();
        assertThat(snapshot.nextSlice()).isEqualTo(new RunSlice(0, 99));
        assertThat(snapshot.estimatedRemainingTime()).isNull();
    }

    @Test
    void checkpoint가_ledger를_넘으면_완료로_보고() {
        // given
        recordFirstHundred(0);

        // when
        ProgressSnapshot snapshot = new ProgressStatusReporter().report(checkpointStore, resultStore, 50);

        // then
        assertThat(snapshot.remainingCount()).isZero();
        assertThat(snapshot.percentComplete()).isEqualTo(100.0);
        assertThat(snapshot.estimatedRemainingRuns()).isZero();
        assertThat(snapshot.nextSlice()).isEqualTo(RunSlice.EMPTY);
        assertThat(snapshot.isComplete()).isTrue();
    }

    @Test
    void 빈_ledger는_100퍼센트_완료() {
        // when
        ProgressSnapshot snapshot = new ProgressStatusReporter().report(checkpointStore, resultStore, 0);

        // then
        assertThat(snapshot.percentComplete()).isEqualTo(100.0);
        assertThat(snapshot.isComplete()).isTrue();
    }

    @Test
    void checkpoint에_없는_기록된_결과도_처리_수에_포함() {
        // given
        recordFirstHundred(0);
        resultStore.append(List.of(Succeeded.of(Ledgers.url(100), Map.of("title", "x"), NOW)));

        // when
        ProgressSnapshot snapshot = new ProgressStatusReporter().report(checkpointStore, resultStore, 1163);

        // then
        assertThat(snapshot.processedCount()).isEqualTo(101);
        assertThat(snapshot.lastIndex()).isEqualTo(99);
    }

    @Test
    void 상태_조회는_저장소를_변경하지_않음() {
        // given
        recordFirstHundred(1);

        // when
        new ProgressStatusReporter().report(checkpointStore, resultStore, 1163);

        // then
        assertThat(checkpointStore.history()).hasSize(1);
        assertThat(resultStore.appendedBatchSizes()).containsExactly(100);
    }

    @Test
    void ledgerSize가_음수면_예외() {
        assertThatThrownBy(() -> new ProgressStatusReporter().report(checkpointStore, resultStore, -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ledgerSize must not be negative");
    }
}
