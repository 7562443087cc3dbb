/**
 * Runner 구현체.
 *
 * <p>{@link com.ryuqq.resumable.adapter.runner.SequentialBatchOrchestrator}가 한 번의 실행을
 * 담당하고, {@link com.ryuqq.resumable.adapter.runner.ChainedRunner}가 실행을 연결합니다.
 * 상태 조회는 {@link com.ryuqq.resumable.adapter.runner.ProgressStatusReporter},
 * 초기화는 {@link com.ryuqq.resumable.adapter.runner.JobReset}이 담당합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.adapter.runner;
