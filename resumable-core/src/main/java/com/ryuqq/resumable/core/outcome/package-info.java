/**
 * 항목 처리 결과 타입.
 *
 * <p>{@link com.ryuqq.resumable.core.outcome.Outcome}은
 * {@link com.ryuqq.resumable.core.outcome.Succeeded}와
 * {@link com.ryuqq.resumable.core.outcome.Failed}만 허용하는 sealed interface입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.core.outcome;
