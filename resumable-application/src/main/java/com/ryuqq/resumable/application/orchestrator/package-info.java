/**
 * Batch Orchestrator 유스케이스.
 *
 * <h2>타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resumable.application.orchestrator.BatchOrchestrator} - runOnce 진입점</li>
 *   <li>{@link com.ryuqq.resumable.application.orchestrator.BatchConfig} - 실행 설정</li>
 *   <li>{@link com.ryuqq.resumable.application.orchestrator.RunReport} - 실행 결과와 hasMoreWork 신호</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.application.orchestrator;
