package com.ryuqq.resumable.adapter.runner;

import java.time.Duration;

/**
 * ChainedRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRuns: 한 번의 runUntilDone 호출에서 실행할 최대 횟수 (기본 1000)</li>
 *   <li>pauseBetweenRuns: 실행 사이 대기 시간 (기본 0)</li>
 * </ul>
 *
 * <p>maxRuns는 Trigger가 계속 CHAIN을 반환하더라도 루프를 끝내는 안전장치입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxRuns 최대 실행 횟수 (1 이상)
 * @param pauseBetweenRuns 실행 사이 대기 시간 (음수 불가)
 */
public record ChainedRunnerConfig(int maxRuns, Duration pauseBetweenRuns) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRuns=1000, pauseBetweenRuns=0</p>
     */
    public ChainedRunnerConfig() {
        this(1000, Duration.ZERO);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ChainedRunnerConfig {
        if (maxRuns <= 0) {
            throw new IllegalArgumentException(
                "maxRuns must be positive (current: " + maxRuns + ")"
            );
        }
        if (pauseBetweenRuns == null) {
            throw new IllegalArgumentException("pauseBetweenRuns cannot be null");
        }
        if (pauseBetweenRuns.isNegative()) {
            throw new IllegalArgumentException(
                "pauseBetweenRuns must not be negative (current: " + pauseBetweenRuns + ")"
            );
        }
    }

    /**
     * maxRuns만 변경한 새 인스턴스 생성.
     *
     * @param maxRuns 새로운 최대 실행 횟수
     * @return 새 ChainedRunnerConfig 인스턴스
     */
    public ChainedRunnerConfig withMaxRuns(int maxRuns) {
        return new ChainedRunnerConfig(maxRuns, this.pauseBetweenRuns);
    }

    /**
     * pauseBetweenRuns만 변경한 새 인스턴스 생성.
     *
     * @param pauseBetweenRuns 새로운 실행 사이 대기 시간
     * @return 새 ChainedRunnerConfig 인스턴스
     */
    public ChainedRunnerConfig withPauseBetweenRuns(Duration pauseBetweenRuns) {
        return new ChainedRunnerConfig(this.maxRuns, pauseBetweenRuns);
    }
}
