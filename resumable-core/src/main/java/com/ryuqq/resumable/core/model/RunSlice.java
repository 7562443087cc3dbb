package com.ryuqq.resumable.core.model;

/**
 * 한 번의 실행에서 시도할 Ledger의 연속 구간.
 *
 * <p>매 실행 시작 시 Checkpoint로부터 새로 계산되며, 영속화되지 않습니다.</p>
 *
 * <p><strong>구간 규칙:</strong></p>
 * <ul>
 *   <li>start, end 모두 포함 (닫힌 구간)</li>
 *   <li>남은 작업이 없으면 {@link #EMPTY} (start=0, end=-1)</li>
 * </ul>
 *
 * @param start 시작 인덱스 (포함)
 * @param end 종료 인덱스 (포함)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunSlice(
    int start,
    int end
) {

    /**
     * 시도할 항목이 없는 빈 구간.
     */
    public static final RunSlice EMPTY = new RunSlice(0, -1);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException start가 음수이거나 end가 start - 1보다 작은 경우
     */
    public RunSlice {
        if (start < 0) {
            throw new IllegalArgumentException("start must not be negative (current: " + start + ")");
        }
        if (end < start - 1) {
            throw new IllegalArgumentException(
                "end must be >= start - 1 (start: " + start + ", end: " + end + ")"
            );
        }
    }

    /**
     * 구간에 포함된 항목 수.
     *
     * @return 항목 수 (빈 구간이면 0)
     */
    public int size() {
        return end - start + 1;
    }

    /**
     * 빈 구간인지 확인.
     *
     * @return 항목이 없으면 true
     */
    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * 인덱스가 구간에 포함되는지 확인.
     *
     * @param index Ledger 인덱스
     * @return 포함되면 true
     */
    public boolean contains(int index) {
        return index >= start && index <= end;
    }

    /**
     * 인덱스가 구간의 마지막 항목인지 확인.
     *
     * @param index Ledger 인덱스
     * @return 마지막 항목이면 true
     */
    public boolean isLast(int index) {
        return !isEmpty() && index == end;
    }
}
