package com.ryuqq.resumable.application.orchestrator;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BatchConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BatchConfigTest {

    @Test
    void 기본값_확인() {
        BatchConfig config = new BatchConfig();

        assertThat(config.maxItemsPerRun()).isEqualTo(100);
        assertThat(config.flushEvery()).isEqualTo(5);
        assertThat(config.interItemDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.hasSoftTimeBudget()).isFalse();
    }

    @Test
    void maxItemsPerRun이_0이면_예외() {
        assertThatThrownBy(() -> new BatchConfig().withMaxItemsPerRun(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxItemsPerRun must be positive (current: 0)");
    }

    @Test
    void flushEvery가_음수면_예외() {
        assertThatThrownBy(() -> new BatchConfig().withFlushEvery(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("flushEvery must be positive");
    }

    @Test
    void interItemDelay가_음수면_예외() {
        assertThatThrownBy(() -> new BatchConfig().withInterItemDelay(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("interItemDelay cannot be null or negative");
    }

    @Test
    void softTimeBudget이_null이면_예외() {
        assertThatThrownBy(() -> new BatchConfig().withSoftTimeBudget(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void with_메서드는_해당_값만_변경() {
        BatchConfig config = new BatchConfig()
            .withMaxItemsPerRun(50)
            .withSoftTimeBudget(Duration.ofHours(5));

        assertThat(config.maxItemsPerRun()).isEqualTo(50);
        assertThat(config.flushEvery()).isEqualTo(5);
        assertThat(config.hasSoftTimeBudget()).isTrue();
    }

    @Test
    void 실행_최대_소요시간_추정() {
        BatchConfig config = new BatchConfig()
            .withMaxItemsPerRun(100)
            .withInterItemDelay(Duration.ofSeconds(1));

        Duration estimate = config.estimatedMaxRunDuration(Duration.ofSeconds(59));

        assertThat(estimate).isEqualTo(Duration.ofMinutes(100));
    }
}
