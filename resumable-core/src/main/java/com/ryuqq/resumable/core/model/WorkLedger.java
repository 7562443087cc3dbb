package com.ryuqq.resumable.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 처리할 식별자의 고정된 순서 목록.
 *
 * <p>실행마다 한 번 로드되며, 이후 변경되지 않습니다.
 * 중복 식별자는 로드 시 제거하지 않고 그대로 유지합니다
 * (실행 중 skip 검사가 두 번째 이후 항목을 무시합니다).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkLedger ledger = WorkLedger.of(List.of("https://a", "https://b"));
 * RunSlice slice = ledger.sliceFrom(checkpoint, 100);
 * for (int i = slice.start(); i &lt;= slice.end(); i++) {
 *     WorkItem item = ledger.get(i);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkLedger {

    private static final WorkLedger EMPTY = new WorkLedger(List.of());

    private final List<WorkItem> items;

    private WorkLedger(List<WorkItem> items) {
        this.items = items;
    }

    /**
     * 식별자 목록으로 WorkLedger 생성.
     *
     * @param ids 순서가 있는 식별자 목록
     * @return WorkLedger 인스턴스
     * @throws IllegalArgumentException ids가 null이거나 null/빈 식별자를 포함하는 경우
     */
    public static WorkLedger of(List<String> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        List<WorkItem> items = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            items.add(new WorkItem(i, ids.get(i)));
        }
        return new WorkLedger(Collections.unmodifiableList(items));
    }

    /**
     * 빈 WorkLedger.
     *
     * @return 항목이 없는 WorkLedger
     */
    public static WorkLedger empty() {
        return EMPTY;
    }

    /**
     * 항목 수 조회.
     *
     * @return 전체 항목 수
     */
    public int size() {
        return items.size();
    }

    /**
     * 마지막 인덱스 조회.
     *
     * @return 마지막 인덱스 (비어있으면 -1)
     */
    public int lastIndex() {
        return items.size() - 1;
    }

    /**
     * 비어있는지 확인.
     *
     * @return 항목이 없으면 true
     */
    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * 인덱스로 항목 조회.
     *
     * @param index Ledger 인덱스
     * @return WorkItem
     * @throws IndexOutOfBoundsException 인덱스가 범위를 벗어난 경우
     */
    public WorkItem get(int index) {
        return items.get(index);
    }

    /**
     * 전체 항목 조회 (읽기 전용).
     *
     * @return 불변 항목 목록
     */
    public List<WorkItem> items() {
        return items;
    }

    /**
     * Checkpoint 다음 위치부터 최대 maxItems개의 구간 계산.
     *
     * <p>start = lastIndex + 1, end = min(start + maxItems - 1, lastIndex()).
     * start가 Ledger 범위를 벗어나면 {@link RunSlice#EMPTY}를 반환합니다.</p>
     *
     * @param checkpoint 현재 Checkpoint
     * @param maxItems 구간 최대 크기 (1 이상)
     * @return 이번 실행에서 시도할 구간
     * @throws IllegalArgumentException checkpoint가 null이거나 maxItems가 양수가 아닌 경우
     */
    public RunSlice sliceFrom(Checkpoint checkpoint, int maxItems) {
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint cannot be null");
        }
        if (maxItems <= 0) {
            throw new IllegalArgumentException("maxItems must be positive (current: " + maxItems + ")");
        }
        int start = checkpoint.nextIndex();
        if (start > lastIndex()) {
            return RunSlice.EMPTY;
        }
        long candidateEnd = (long) start + maxItems - 1;
        int end = (int) Math.min(candidateEnd, lastIndex());
        return new RunSlice(start, end);
    }

    @Override
    public String toString() {
        return "WorkLedger{size=" + items.size() + '}';
    }
}
