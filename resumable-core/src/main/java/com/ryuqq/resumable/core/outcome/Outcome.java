package com.ryuqq.resumable.core.outcome;

import java.time.Instant;
import java.util.Map;

/**
 * 항목 하나의 기록된 처리 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Succeeded}: 추출 성공, payload 보유</li>
 *   <li>{@link Failed}: 추출 실패, 실패 사유 보유</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 경우 외의 구현을 허용하지 않습니다.
 * 정상 상태에서는 식별자당 정확히 하나의 Outcome만 존재합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Succeeded, Failed {

    /**
     * 항목 식별자.
     *
     * @return 식별자
     */
    String id();

    /**
     * 기록 시각.
     *
     * @return 결과가 생성된 시각
     */
    Instant recordedAt();

    /**
     * 결과 상태.
     *
     * @return SUCCEEDED 또는 FAILED
     */
    OutcomeStatus status();

    /**
     * 추출 결과 데이터.
     *
     * @return 성공이면 payload, 실패면 null
     */
    default Map<String, Object> payload() {
        return null;
    }

    /**
     * 실패 사유.
     *
     * @return 실패면 사유, 성공이면 null
     */
    default String error() {
        return null;
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }
}
