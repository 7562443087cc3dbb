package com.ryuqq.resumable.core.model;

/**
 * Work Ledger의 단일 작업 항목.
 *
 * <p>식별자(예: URL)와 Ledger 내 위치(0부터 시작하는 인덱스)로 구성됩니다.
 * 식별자는 불투명 문자열로 취급하며 해석하지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @param index Ledger 내 위치 (0 이상)
 * @param id 항목 식별자 (null 또는 빈 문자열 불가)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WorkItem(
    int index,
    String id
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException index가 음수이거나 id가 null/빈 문자열인 경우
     */
    public WorkItem {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative (current: " + index + ")");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
    }
}
