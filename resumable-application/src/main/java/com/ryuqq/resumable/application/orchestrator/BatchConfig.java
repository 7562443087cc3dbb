package com.ryuqq.resumable.application.orchestrator;

import java.time.Duration;

/**
 * Batch Orchestrator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxItemsPerRun: 한 실행에서 시도할 최대 항목 수 (기본 100)</li>
 *   <li>flushEvery: 버퍼된 결과가 이 수에 도달하면 flush (기본 5)</li>
 *   <li>interItemDelay: 추출 시도 간 최소 간격 (기본 1초)</li>
 *   <li>softTimeBudget: 경과 시간이 이 값에 도달하면 다음 항목 전에 멈춤 (기본 0 = 사용 안 함)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>실행 최대 시간 ≈ maxItemsPerRun × (추출 타임아웃 + interItemDelay).
 *       외부 시간 제한보다 충분히 작게 maxItemsPerRun을 잡습니다.</li>
 *   <li>flushEvery를 줄이면 비정상 종료 시 다시 처리할 항목이 줄어들고, 쓰기 횟수는 늘어납니다.</li>
 *   <li>interItemDelay는 대상 서버 부하와 자동화 탐지를 피하기 위한 값입니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxItemsPerRun 실행당 최대 항목 수 (1 이상)
 * @param flushEvery flush 주기 (1 이상)
 * @param interItemDelay 항목 간 대기 시간 (0 이상)
 * @param softTimeBudget 실행 시간 예산 (0이면 사용 안 함)
 */
public record BatchConfig(
    int maxItemsPerRun,
    int flushEvery,
    Duration interItemDelay,
    Duration softTimeBudget
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxItemsPerRun=100, flushEvery=5, interItemDelay=1s, softTimeBudget=0</p>
     */
    public BatchConfig() {
        this(100, 5, Duration.ofSeconds(1), Duration.ZERO);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchConfig {
        if (maxItemsPerRun <= 0) {
            throw new IllegalArgumentException(
                "maxItemsPerRun must be positive (current: " + maxItemsPerRun + ")"
            );
        }
        if (flushEvery <= 0) {
            throw new IllegalArgumentException(
                "flushEvery must be positive (current: " + flushEvery + ")"
            );
        }
        if (interItemDelay == null || interItemDelay.isNegative()) {
            throw new IllegalArgumentException(
                "interItemDelay cannot be null or negative (current: " + interItemDelay + ")"
            );
        }
        if (softTimeBudget == null || softTimeBudget.isNegative()) {
            throw new IllegalArgumentException(
                "softTimeBudget cannot be null or negative (current: " + softTimeBudget + ")"
            );
        }
    }

    /**
     * 실행 시간 예산 사용 여부.
     *
     * @return softTimeBudget이 0보다 크면 true
     */
    public boolean hasSoftTimeBudget() {
        return !softTimeBudget.isZero();
    }

    /**
     * 한 실행의 최대 소요 시간 추정.
     *
     * @param extractionTimeout 항목 하나의 추출 타임아웃
     * @return maxItemsPerRun × (extractionTimeout + interItemDelay)
     * @throws IllegalArgumentException extractionTimeout이 null이거나 음수인 경우
     */
    public Duration estimatedMaxRunDuration(Duration extractionTimeout) {
        if (extractionTimeout == null || extractionTimeout.isNegative()) {
            throw new IllegalArgumentException("extractionTimeout cannot be null or negative");
        }
        return extractionTimeout.plus(interItemDelay).multipliedBy(maxItemsPerRun);
    }

    /**
     * maxItemsPerRun만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withMaxItemsPerRun(int maxItemsPerRun) {
        return new BatchConfig(maxItemsPerRun, flushEvery, interItemDelay, softTimeBudget);
    }

    /**
     * flushEvery만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withFlushEvery(int flushEvery) {
        return new BatchConfig(maxItemsPerRun, flushEvery, interItemDelay, softTimeBudget);
    }

    /**
     * interItemDelay만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withInterItemDelay(Duration interItemDelay) {
        return new BatchConfig(maxItemsPerRun, flushEvery, interItemDelay, softTimeBudget);
    }

    /**
     * softTimeBudget만 변경한 새 인스턴스 생성.
     */
    public BatchConfig withSoftTimeBudget(Duration softTimeBudget) {
        return new BatchConfig(maxItemsPerRun, flushEvery, interItemDelay, softTimeBudget);
    }
}
