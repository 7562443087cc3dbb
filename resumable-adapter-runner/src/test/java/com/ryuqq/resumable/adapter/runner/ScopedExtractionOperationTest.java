package com.ryuqq.resumable.adapter.runner;

import com.ryuqq.resumable.core.extraction.ExtractionResult;
import com.ryuqq.resumable.core.outcome.OutcomeStatus;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScopedExtractionOperation 테스트.
 *
 * <p>모든 종료 경로에서 자원이 해제되는지, 빈 내용이 실패로 변환되는지 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ScopedExtractionOperationTest {

    private static final class Session implements AutoCloseable {

        private final AtomicInteger closed;
        private final boolean failOnClose;

        Session(AtomicInteger closed, boolean failOnClose) {
            this.closed = closed;
            this.failOnClose = failOnClose;
        }

        @Override
        public void close() {
            closed.incrementAndGet();
            if (failOnClose) {
                throw new IllegalStateException("session already gone");
            }
        }
    }

    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();

    private Session open() {
        opened.incrementAndGet();
        return new Session(closed, false);
    }

    @Test
    void 성공하면_payload를_반환하고_자원을_해제() throws Exception {
        // given
        ScopedExtractionOperation<Session> operation = new ScopedExtractionOperation<>(
            this::open, (session, id) -> Map.of("title", "Title of " + id));

        // when
        ExtractionResult result = operation.extract("https://a");

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.payload()).containsEntry("title", "Title of https://a");
        assertThat(closed.get()).isEqualTo(1);
    }

    @Test
    void 호출마다_새_자원을_획득() throws Exception {
        // given
        ScopedExtractionOperation<Session> operation = new ScopedExtractionOperation<>(
            this::open, (session, id) -> Map.of("title", id));

        // when
        operation.extract("https://a");
        operation.extract("https://b");

        // then
        assertThat(opened.get()).isEqualTo(2);
        assertThat(closed.get()).isEqualTo(2);
    }

    @Test
    void 추출_중_예외는_실패로_변환되고_자원은_해제() throws Exception {
        // given
        ScopedExtractionOperation<Session> operation = new ScopedExtractionOperation<>(
            this::open, (session, id) -> {
                throw new IllegalStateException("timeout after 30s");
            });

        // when
        ExtractionResult result = operation.extract("https://a");

        // then
        assertThat(result.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(result.error()).isEqualTo("IllegalStateException: timeout after 30s");
        assertThat(closed.get()).isEqualTo(1);
    }

    @Test
    void 빈_payload는_Empty_content_실패() throws Exception {
        // given
        ScopedExtractionOperation<Session> operation = new ScopedExtractionOperation<>(
            this::open, (session, id) -> Map.of());

        // when
        ExtractionResult result = operation.extract("https://a");

        // then
        assertThat(result.error()).isEqualTo("Empty content");
        assertThat(closed.get()).isEqualTo(1);
    }

    @Test
    void 모든_값이_공백이거나_null인_payload도_Empty_content_실패() throws Exception {
        // given
        Map<String, Object> blank = new HashMap<>();
        blank.put("title", "   ");
        blank.put("body", null);
        ScopedExtractionOperation<Session> operation = new ScopedExtractionOperation<>(
            this::open, (session, id) -> blank);

        // when
        ExtractionResult result = operation.extract("https://a");

        // then
        assertThat(result.error()).isEqualTo("Empty content");
    }

    @Test
    void null_payload도_Empty_content_실패() throws Exception {
        ScopedExtractionOperation<Session> operation = new ScopedExtractionOperation<>(
            this::open, (session, id) -> null);

        assertThat(operation.extract("https://a").error()).isEqualTo("Empty content");
    }

    @Test
    void 자원_획득_실패는_실패_결과로_변환() throws Exception {
        // given
        ScopedExtractionOperation<Session> operation = new ScopedExtractionOperation<>(
            () -> {
                throw new IllegalStateException("browser failed to start");
            },
            (session, id) -> Map.of("title", id));

        // when
        ExtractionResult result = operation.extract("https://a");

        // then
        assertThat(result.error()).isEqualTo("Resource unavailable: IllegalStateException: browser failed to start");
        assertThat(closed.get()).isZero();
    }

    @Test
    void 자원_해제_실패는_결과에_영향을_주지_않음() throws Exception {
        // given
        ScopedExtractionOperation<Session> operation = new ScopedExtractionOperation<>(
            () -> new Session(closed, true), (session, id) -> Map.of("title", id));

        // when
        ExtractionResult result = operation.extract("https://a");

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(closed.get()).isEqualTo(1);
    }

    @Test
    void 인터럽트는_자원_해제_후_전파() {
        // given
        ScopedExtractionOperation<Session> operation = new ScopedExtractionOperation<>(
            this::open, (session, id) -> {
                throw new InterruptedException("cancelled");
            });

        // when & then
        assertThatThrownBy(() -> operation.extract("https://a"))
            .isInstanceOf(InterruptedException.class);
        assertThat(closed.get()).isEqualTo(1);
    }

    @Test
    void 생성자_extractor가_null이면_예외() {
        assertThatThrownBy(() -> new ScopedExtractionOperation<Session>(this::open, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("extractor cannot be null");
    }
}
