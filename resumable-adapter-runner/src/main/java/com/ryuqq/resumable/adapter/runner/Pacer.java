package com.ryuqq.resumable.adapter.runner;

import java.time.Duration;

/**
 * 추출 시도 사이의 대기 전략.
 *
 * <p>기본 구현은 {@link Thread#sleep(long)}이며, 테스트에서는 실제 대기 없이
 * 호출만 기록하는 구현으로 교체합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Pacer {

    /**
     * 지정된 시간만큼 대기.
     *
     * @param duration 대기 시간 (0이면 즉시 반환)
     * @throws RuntimeException 대기 중 인터럽트 발생 시 (인터럽트 플래그 복원)
     */
    void pause(Duration duration);

    /**
     * Thread.sleep 기반 Pacer.
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * RuntimeException으로 래핑하여 던집니다.</p>
     *
     * @return 실제로 대기하는 Pacer
     */
    static Pacer threadSleep() {
        return duration -> {
            if (duration.isZero()) {
                return;
            }
            try {
                Thread.sleep(duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Inter-item delay interrupted", e);
            }
        };
    }
}
