/**
 * Extraction Operation 계약.
 *
 * <p>실제 추출 로직(네트워크 요청, 내용 파싱)은 이 패키지의
 * {@link com.ryuqq.resumable.core.extraction.ExtractionOperation} 구현체로 주입됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.core.extraction;
