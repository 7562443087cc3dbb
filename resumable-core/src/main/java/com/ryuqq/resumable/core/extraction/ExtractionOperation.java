package com.ryuqq.resumable.core.extraction;

/**
 * 식별자 하나에 대한 추출 작업 (외부 협력자).
 *
 * <p>네트워크 요청과 내용 파싱은 이 인터페이스 뒤에 숨겨지며,
 * Orchestrator는 결과만 받아 기록합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>호출 간 가변 상태를 유지하지 않습니다 (항목마다 독립 실행).</li>
 *   <li>무거운 자원(브라우저 등)은 호출 안에서 획득하고, 모든 종료 경로에서 해제합니다.</li>
 *   <li>실패는 예외보다 {@link ExtractionResult#failure(String)} 반환을 우선합니다.
 *       그래도 던져진 예외는 Orchestrator가 실패 결과로 변환합니다.</li>
 *   <li>한 실행 안에서는 순차적으로만 호출됩니다 (동시 호출 없음).</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ExtractionOperation operation = id -&gt; {
 *     Map&lt;String, Object&gt; page = fetchAndParse(id);
 *     return page.isEmpty()
 *         ? ExtractionResult.failure("Empty content")
 *         : ExtractionResult.success(page);
 * };
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ExtractionOperation {

    /**
     * 식별자 하나를 추출.
     *
     * @param id 항목 식별자 (예: URL)
     * @return 추출 결과 (null 불가)
     * @throws Exception 추출 중 처리되지 않은 오류 (Orchestrator가 실패 결과로 변환)
     */
    ExtractionResult extract(String id) throws Exception;
}
