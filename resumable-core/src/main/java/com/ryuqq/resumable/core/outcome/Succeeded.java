package com.ryuqq.resumable.core.outcome;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 성공 결과.
 *
 * <p>Extraction Operation이 구조화된 결과를 반환했음을 나타냅니다.</p>
 *
 * @param id 항목 식별자
 * @param payload 추출 결과 (불변 복사본, 키 순서 유지)
 * @param recordedAt 기록 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Succeeded(
    String id,
    Map<String, Object> payload,
    Instant recordedAt
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id, payload, recordedAt 중 하나라도 null이거나 id가 빈 문자열인 경우
     */
    public Succeeded {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (recordedAt == null) {
            throw new IllegalArgumentException("recordedAt cannot be null");
        }
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * Succeeded 생성.
     *
     * @param id 항목 식별자
     * @param payload 추출 결과
     * @param recordedAt 기록 시각
     * @return Succeeded 인스턴스
     */
    public static Succeeded of(String id, Map<String, Object> payload, Instant recordedAt) {
        return new Succeeded(id, payload, recordedAt);
    }

    @Override
    public OutcomeStatus status() {
        return OutcomeStatus.SUCCEEDED;
    }
}
