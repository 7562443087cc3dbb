package com.ryuqq.resumable.core.outcome;

import java.time.Instant;

/**
 * 실패 결과.
 *
 * <p>대상에 도달할 수 없거나, 내용이 비정상이거나, 시간 초과 등으로 추출하지 못한 경우입니다.
 * 실패도 "처리됨"으로 간주되며 같은 작업 안에서 자동 재시도하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Extraction Operation이 예외를 던짐</li>
 *   <li>실행 환경 사용 불가 (브라우저/런타임 기동 실패)</li>
 *   <li>빈 내용 ("Empty content")</li>
 * </ul>
 *
 * @param id 항목 식별자
 * @param error 실패 사유
 * @param recordedAt 기록 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Failed(
    String id,
    String error,
    Instant recordedAt
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id 또는 error가 null/빈 문자열이거나 recordedAt이 null인 경우
     */
    public Failed {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error cannot be null or blank");
        }
        if (recordedAt == null) {
            throw new IllegalArgumentException("recordedAt cannot be null");
        }
    }

    /**
     * Failed 생성.
     *
     * @param id 항목 식별자
     * @param error 실패 사유
     * @param recordedAt 기록 시각
     * @return Failed 인스턴스
     */
    public static Failed of(String id, String error, Instant recordedAt) {
        return new Failed(id, error, recordedAt);
    }

    /**
     * 예외로부터 Failed 생성.
     *
     * <p>메시지가 없는 예외는 예외 클래스 이름을 사유로 사용합니다.</p>
     *
     * @param id 항목 식별자
     * @param cause 원인 예외
     * @param recordedAt 기록 시각
     * @return Failed 인스턴스
     */
    public static Failed fromException(String id, Throwable cause, Instant recordedAt) {
        return new Failed(id, describe(cause), recordedAt);
    }

    /**
     * 예외를 실패 사유 문자열로 변환 ("SimpleName: message" 또는 "SimpleName").
     *
     * @param cause 원인 예외
     * @return 실패 사유
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static String describe(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        String name = cause.getClass().getSimpleName();
        if (name.isBlank()) {
            // 익명 클래스는 SimpleName이 비어 있음
            name = cause.getClass().getName();
        }
        String message = cause.getMessage();
        return (message == null || message.isBlank())
            ? name
            : name + ": " + message;
    }

    @Override
    public OutcomeStatus status() {
        return OutcomeStatus.FAILED;
    }
}
