package com.ryuqq.resumable.application.orchestrator;

import com.ryuqq.resumable.core.model.WorkLedger;
import com.ryuqq.resumable.core.spi.CheckpointStore;
import com.ryuqq.resumable.core.spi.ResultStore;

/**
 * 한 번의 실행(execution)을 조정하는 Batch Orchestrator.
 *
 * <p>Ledger의 다음 구간을 계산하고, 항목을 순차적으로 추출하며,
 * 정해진 주기로 결과를 flush한 뒤 Checkpoint를 전진시킵니다.
 * 외부 시간 제한 안에서 끝나는 짧은 실행을 여러 번 연결하여 긴 작업을 완료합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RunReport report = orchestrator.runOnce(ledger, checkpointStore, resultStore, new BatchConfig());
 *
 * if (report.hasMoreWork()) {
 *     // Run Trigger가 다음 실행을 연결
 * } else {
 *     // 작업 완료
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BatchOrchestrator {

    /**
     * 한 구간을 처리하고 결과 보고서를 반환.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>Checkpoint 로드, start = lastIndex + 1 계산 (범위 밖이면 즉시 완료 보고)</li>
     *   <li>end = min(start + maxItemsPerRun - 1, ledger 마지막 인덱스)</li>
     *   <li>start..end 순서대로:
     *     <ul>
     *       <li>이미 처리된 식별자면 skip</li>
     *       <li>Extraction Operation 호출 (예외는 실패 결과로 변환)</li>
     *       <li>결과를 버퍼에 추가, interItemDelay 대기</li>
     *       <li>버퍼가 flushEvery에 도달하거나 구간 끝이면 flush:
     *           Result Store append → Checkpoint 갱신 (이 순서 고정)</li>
     *     </ul>
     *   </li>
     *   <li>시도/성공/실패 수와 hasMoreWork를 담은 RunReport 반환</li>
     * </ol>
     *
     * @param ledger 전체 Work Ledger
     * @param checkpointStore Checkpoint 저장소
     * @param resultStore 결과 저장소
     * @param config 실행 설정
     * @return 실행 보고서
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws com.ryuqq.resumable.core.spi.StoreException 저장소 쓰기 실패 시 (실행 중단, 이전 Checkpoint 유지)
     */
    RunReport runOnce(WorkLedger ledger, CheckpointStore checkpointStore, ResultStore resultStore, BatchConfig config);
}
