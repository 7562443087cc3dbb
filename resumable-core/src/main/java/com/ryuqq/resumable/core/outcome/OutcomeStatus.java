package com.ryuqq.resumable.core.outcome;

/**
 * 항목 처리 결과 상태.
 *
 * <p>두 상태 모두 종료 상태이며, 한 번 기록된 항목은 같은 작업 안에서 다시 시도하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum OutcomeStatus {

    /**
     * 추출 성공 (payload 존재).
     */
    SUCCEEDED("succeeded"),

    /**
     * 추출 실패 (error 존재).
     */
    FAILED("failed");

    private final String wireName;

    OutcomeStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 영속 레이아웃에서 사용하는 이름.
     *
     * @return "succeeded" 또는 "failed"
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 영속 레이아웃 이름으로 상태 조회.
     *
     * @param wireName "succeeded" 또는 "failed" (대소문자 무시)
     * @return OutcomeStatus
     * @throws IllegalArgumentException 알 수 없는 이름인 경우
     */
    public static OutcomeStatus fromWireName(String wireName) {
        for (OutcomeStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(wireName)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown outcome status: " + wireName);
    }
}
