package com.ryuqq.resumable.adapter.runner;

import com.ryuqq.resumable.core.extraction.ExtractionOperation;
import com.ryuqq.resumable.core.extraction.ExtractionResult;
import com.ryuqq.resumable.core.outcome.Failed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 호출마다 무거운 자원을 새로 획득하고 해제하는 Extraction Operation.
 *
 * <p>브라우저 세션처럼 비용이 큰 자원을 항목 하나의 추출 범위 안에서만 사용합니다.
 * 자원은 성공, 실패, 예외 모든 경로에서 해제되며, 이전 항목의 상태가
 * 다음 항목으로 넘어가지 않습니다.</p>
 *
 * <p><strong>결과 변환 규칙:</strong></p>
 * <ul>
 *   <li>자원 획득 실패 → failure("Resource unavailable: ...")</li>
 *   <li>payload가 null, 비어있음, 또는 모든 값이 null/공백 → failure("Empty content")</li>
 *   <li>추출 중 예외 → failure("ExceptionType: message")</li>
 *   <li>InterruptedException → 자원 해제 후 그대로 전파</li>
 * </ul>
 *
 * @param <R> 자원 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScopedExtractionOperation<R extends AutoCloseable> implements ExtractionOperation {

    private static final Logger log = LoggerFactory.getLogger(ScopedExtractionOperation.class);

    static final String EMPTY_CONTENT = "Empty content";

    private final ResourceFactory<R> resourceFactory;
    private final Extractor<R> extractor;

    /**
     * 자원 생성 함수.
     *
     * @param <R> 자원 타입
     */
    @FunctionalInterface
    public interface ResourceFactory<R> {
        R acquire() throws Exception;
    }

    /**
     * 자원을 사용해 항목 하나를 추출하는 함수.
     *
     * @param <R> 자원 타입
     */
    @FunctionalInterface
    public interface Extractor<R> {
        Map<String, Object> extract(R resource, String id) throws Exception;
    }

    /**
     * 생성자.
     *
     * @param resourceFactory 호출마다 새 자원을 만드는 함수
     * @param extractor 자원으로 payload를 만드는 함수
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ScopedExtractionOperation(ResourceFactory<R> resourceFactory, Extractor<R> extractor) {
        if (resourceFactory == null) {
            throw new IllegalArgumentException("resourceFactory cannot be null");
        }
        if (extractor == null) {
            throw new IllegalArgumentException("extractor cannot be null");
        }
        this.resourceFactory = resourceFactory;
        this.extractor = extractor;
    }

    @Override
    public ExtractionResult extract(String id) throws InterruptedException {
        R resource;
        try {
            resource = resourceFactory.acquire();
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to acquire resource for {}", id, e);
            return ExtractionResult.failure("Resource unavailable: " + Failed.describe(e));
        }

        try {
            Map<String, Object> payload = extractor.extract(resource, id);
            if (isEmpty(payload)) {
                return ExtractionResult.failure(EMPTY_CONTENT);
            }
            return ExtractionResult.success(payload);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            return ExtractionResult.failure(Failed.describe(e));
        } finally {
            release(resource, id);
        }
    }

    private void release(R resource, String id) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to release resource for {}", id, e);
        }
    }

    private static boolean isEmpty(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return true;
        }
        for (Object value : payload.values()) {
            if (value instanceof String) {
                if (!((String) value).isBlank()) {
                    return false;
                }
            } else if (value != null) {
                return false;
            }
        }
        return true;
    }
}
