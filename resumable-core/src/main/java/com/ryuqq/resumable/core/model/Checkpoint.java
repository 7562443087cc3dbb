package com.ryuqq.resumable.core.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 작업 진행 상황의 영속 기록.
 *
 * <p>완전히 처리된 마지막 인덱스와 이미 처리된(성공 또는 영구 실패) 식별자 집합을 담습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>lastIndex는 -1 이상 (-1은 아직 처리된 항목 없음)</li>
 *   <li>lastIndex는 감소하지 않음</li>
 *   <li>processedIds는 추가만 가능하고 제거되지 않음</li>
 * </ul>
 *
 * <p>{@link #advance(int, Collection, Instant)}는 새 인스턴스를 반환하며
 * 위 불변식을 위반하는 호출은 거부합니다.</p>
 *
 * @param lastIndex 완전히 처리된 가장 높은 인덱스 (-1 이상)
 * @param processedIds 처리된 식별자 집합 (불변, 삽입 순서 유지)
 * @param updatedAt 마지막 갱신 시각 (빈 Checkpoint이면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Checkpoint(
    int lastIndex,
    Set<String> processedIds,
    Instant updatedAt
) {

    private static final Checkpoint EMPTY = new Checkpoint(-1, Set.of(), null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException lastIndex가 -1보다 작거나 processedIds가 null인 경우
     */
    public Checkpoint {
        if (lastIndex < -1) {
            throw new IllegalArgumentException("lastIndex must be >= -1 (current: " + lastIndex + ")");
        }
        if (processedIds == null) {
            throw new IllegalArgumentException("processedIds cannot be null");
        }
        processedIds = Collections.unmodifiableSet(new LinkedHashSet<>(processedIds));
        // updatedAt은 null 허용
    }

    /**
     * 처리 이력이 없는 빈 Checkpoint.
     *
     * @return lastIndex=-1, processedIds 비어있음
     */
    public static Checkpoint empty() {
        return EMPTY;
    }

    /**
     * 다음에 시도할 인덱스.
     *
     * @return lastIndex + 1
     */
    public int nextIndex() {
        return lastIndex + 1;
    }

    /**
     * 식별자가 이미 처리되었는지 확인.
     *
     * @param id 식별자
     * @return 처리되었으면 true
     */
    public boolean isProcessed(String id) {
        return processedIds.contains(id);
    }

    /**
     * 처리된 식별자 수.
     *
     * @return processedIds 크기
     */
    public int processedCount() {
        return processedIds.size();
    }

    /**
     * 처리 이력이 없는지 확인.
     *
     * @return lastIndex가 -1이고 processedIds가 비어있으면 true
     */
    public boolean isEmpty() {
        return lastIndex == -1 && processedIds.isEmpty();
    }

    /**
     * Checkpoint를 전진시킨 새 인스턴스 생성.
     *
     * @param newLastIndex 새 lastIndex (현재 값 이상)
     * @param newlyProcessed 새로 처리된 식별자들
     * @param at 갱신 시각
     * @return 전진된 Checkpoint
     * @throws IllegalArgumentException newLastIndex가 현재 값보다 작거나 인자가 null인 경우
     */
    public Checkpoint advance(int newLastIndex, Collection<String> newlyProcessed, Instant at) {
        if (newLastIndex < lastIndex) {
            throw new IllegalArgumentException(
                "lastIndex cannot move backwards (current: " + lastIndex + ", requested: " + newLastIndex + ")"
            );
        }
        if (newlyProcessed == null) {
            throw new IllegalArgumentException("newlyProcessed cannot be null");
        }
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        Set<String> merged = new LinkedHashSet<>(processedIds);
        merged.addAll(newlyProcessed);
        return new Checkpoint(newLastIndex, merged, at);
    }

    /**
     * 추가 식별자를 합친 새 인스턴스 생성 (lastIndex, updatedAt 유지).
     *
     * <p>Result Store에는 기록되었지만 Checkpoint 갱신 전에 중단된 항목을
     * 복구할 때 사용합니다.</p>
     *
     * @param ids 합칠 식별자들
     * @return processedIds가 확장된 Checkpoint (추가할 것이 없으면 this)
     * @throws IllegalArgumentException ids가 null인 경우
     */
    public Checkpoint withProcessed(Collection<String> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        if (processedIds.containsAll(ids)) {
            return this;
        }
        Set<String> merged = new LinkedHashSet<>(processedIds);
        merged.addAll(ids);
        return new Checkpoint(lastIndex, merged, updatedAt);
    }

    @Override
    public String toString() {
        return "Checkpoint{lastIndex=" + lastIndex
            + ", processed=" + processedIds.size()
            + ", updatedAt=" + updatedAt + '}';
    }
}
