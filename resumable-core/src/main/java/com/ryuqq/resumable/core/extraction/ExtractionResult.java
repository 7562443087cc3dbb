package com.ryuqq.resumable.core.extraction;

import com.ryuqq.resumable.core.outcome.Failed;
import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.outcome.OutcomeStatus;
import com.ryuqq.resumable.core.outcome.Succeeded;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extraction Operation의 반환값.
 *
 * <p>상태와 payload 또는 실패 사유를 담으며, 식별자와 기록 시각은
 * 호출자(Orchestrator)가 {@link #toOutcome(String, Instant)}로 붙입니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>SUCCEEDED: payload 필수, error는 null</li>
 *   <li>FAILED: error 필수, payload는 null</li>
 * </ul>
 *
 * @param status 결과 상태
 * @param payload 추출 결과 (성공 시)
 * @param error 실패 사유 (실패 시)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ExtractionResult(
    OutcomeStatus status,
    Map<String, Object> payload,
    String error
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 상태와 payload/error 조합이 맞지 않는 경우
     */
    public ExtractionResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status == OutcomeStatus.SUCCEEDED) {
            if (payload == null) {
                throw new IllegalArgumentException("payload cannot be null for a succeeded result");
            }
            if (error != null) {
                throw new IllegalArgumentException("error must be null for a succeeded result");
            }
            payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        } else {
            if (error == null || error.isBlank()) {
                throw new IllegalArgumentException("error cannot be null or blank for a failed result");
            }
            if (payload != null) {
                throw new IllegalArgumentException("payload must be null for a failed result");
            }
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param payload 추출 결과
     * @return ExtractionResult 인스턴스
     */
    public static ExtractionResult success(Map<String, Object> payload) {
        return new ExtractionResult(OutcomeStatus.SUCCEEDED, payload, null);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 실패 사유
     * @return ExtractionResult 인스턴스
     */
    public static ExtractionResult failure(String error) {
        return new ExtractionResult(OutcomeStatus.FAILED, null, error);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCEEDED;
    }

    /**
     * 식별자와 기록 시각을 붙여 Outcome으로 변환.
     *
     * @param id 항목 식별자
     * @param recordedAt 기록 시각
     * @return Succeeded 또는 Failed
     */
    public Outcome toOutcome(String id, Instant recordedAt) {
        if (isSuccess()) {
            return Succeeded.of(id, payload, recordedAt);
        }
        return Failed.of(id, error, recordedAt);
    }
}
