package com.ryuqq.resumable.adapter.runner;

import java.time.Duration;

/**
 * ProgressStatusReporter 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxItemsPerRun: 남은 실행 횟수 계산에 쓰는 실행당 최대 항목 수 (기본 100)</li>
 *   <li>perRunEstimate: 실행 1회 예상 소요 시간 (기본 null = 남은 시간 추정 안 함)</li>
 * </ul>
 *
 * <p>maxItemsPerRun은 Orchestrator의 {@code BatchConfig.maxItemsPerRun}과 같은 값을 사용해야
 * 남은 실행 횟수와 다음 구간이 실제와 일치합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxItemsPerRun 실행당 최대 항목 수 (1 이상)
 * @param perRunEstimate 실행 1회 예상 소요 시간 (null 허용, 음수 불가)
 */
public record StatusReporterConfig(int maxItemsPerRun, Duration perRunEstimate) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxItemsPerRun=100, perRunEstimate=null</p>
     */
    public StatusReporterConfig() {
        this(100, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StatusReporterConfig {
        if (maxItemsPerRun <= 0) {
            throw new IllegalArgumentException(
                "maxItemsPerRun must be positive (current: " + maxItemsPerRun + ")"
            );
        }
        if (perRunEstimate != null && perRunEstimate.isNegative()) {
            throw new IllegalArgumentException(
                "perRunEstimate must not be negative (current: " + perRunEstimate + ")"
            );
        }
    }

    /**
     * maxItemsPerRun만 변경한 새 인스턴스 생성.
     *
     * @param maxItemsPerRun 새로운 실행당 최대 항목 수
     * @return 새 StatusReporterConfig 인스턴스
     */
    public StatusReporterConfig withMaxItemsPerRun(int maxItemsPerRun) {
        return new StatusReporterConfig(maxItemsPerRun, this.perRunEstimate);
    }

    /**
     * perRunEstimate만 변경한 새 인스턴스 생성.
     *
     * @param perRunEstimate 새로운 실행 1회 예상 소요 시간
     * @return 새 StatusReporterConfig 인스턴스
     */
    public StatusReporterConfig withPerRunEstimate(Duration perRunEstimate) {
        return new StatusReporterConfig(this.maxItemsPerRun, perRunEstimate);
    }
}
