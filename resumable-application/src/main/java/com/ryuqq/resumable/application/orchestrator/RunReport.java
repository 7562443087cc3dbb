package com.ryuqq.resumable.application.orchestrator;

import com.ryuqq.resumable.core.model.RunSlice;

import java.time.Duration;

/**
 * 한 실행의 결과 보고서.
 *
 * <p>Run Trigger는 {@link #hasMoreWork()}만 보고 다음 실행 여부를 결정합니다.</p>
 *
 * @param slice 이번 실행에서 계산된 구간 (완료 상태면 {@link RunSlice#EMPTY})
 * @param attempted Extraction Operation을 호출한 항목 수
 * @param succeeded 성공 결과 수
 * @param failed 실패 결과 수
 * @param skipped 이미 처리되어 건너뛴 항목 수
 * @param lastIndex 실행 종료 시점의 Checkpoint lastIndex
 * @param hasMoreWork 남은 항목이 있으면 true
 * @param stoppedEarly 시간 예산 때문에 구간 끝 전에 멈췄으면 true
 * @param elapsed 실행 소요 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunReport(
    RunSlice slice,
    int attempted,
    int succeeded,
    int failed,
    int skipped,
    int lastIndex,
    boolean hasMoreWork,
    boolean stoppedEarly,
    Duration elapsed
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException slice/elapsed가 null이거나 카운트가 음수 또는 불일치하는 경우
     */
    public RunReport {
        if (slice == null) {
            throw new IllegalArgumentException("slice cannot be null");
        }
        if (elapsed == null) {
            throw new IllegalArgumentException("elapsed cannot be null");
        }
        if (attempted < 0 || succeeded < 0 || failed < 0 || skipped < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        if (succeeded + failed != attempted) {
            throw new IllegalArgumentException(
                "succeeded + failed must equal attempted (attempted: " + attempted
                    + ", succeeded: " + succeeded + ", failed: " + failed + ")"
            );
        }
    }

    /**
     * 시도할 항목이 없어 즉시 끝난 실행의 보고서.
     *
     * @param lastIndex 현재 Checkpoint lastIndex
     * @param elapsed 소요 시간
     * @return 완료 보고서 (attempted=0, hasMoreWork=false)
     */
    public static RunReport jobComplete(int lastIndex, Duration elapsed) {
        return new RunReport(RunSlice.EMPTY, 0, 0, 0, 0, lastIndex, false, false, elapsed);
    }

    /**
     * 전체 작업이 끝났는지 확인.
     *
     * @return hasMoreWork의 반대
     */
    public boolean isJobComplete() {
        return !hasMoreWork;
    }
}
