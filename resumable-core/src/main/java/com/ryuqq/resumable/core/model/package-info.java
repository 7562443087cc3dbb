/**
 * 도메인 모델 패키지.
 *
 * <h2>타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resumable.core.model.WorkItem} - Ledger 항목 (인덱스 + 식별자)</li>
 *   <li>{@link com.ryuqq.resumable.core.model.WorkLedger} - 불변 작업 목록</li>
 *   <li>{@link com.ryuqq.resumable.core.model.RunSlice} - 한 실행에서 시도할 구간</li>
 *   <li>{@link com.ryuqq.resumable.core.model.Checkpoint} - 영속 진행 기록</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>불변성:</strong> 모든 타입은 생성 후 변경 불가</li>
 *   <li><strong>유효성 검증:</strong> 생성 시점에 IllegalArgumentException으로 거부</li>
 *   <li><strong>의존성 없음:</strong> 외부 라이브러리를 사용하지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.core.model;
