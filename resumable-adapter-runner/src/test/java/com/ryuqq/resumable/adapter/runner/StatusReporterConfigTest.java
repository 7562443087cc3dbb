package com.ryuqq.resumable.adapter.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatusReporterConfigTest {

    @Test
    void 기본값은_100개와_추정시간_없음() {
        StatusReporterConfig config = new StatusReporterConfig();

        assertThat(config.maxItemsPerRun()).isEqualTo(100);
        assertThat(config.perRunEstimate()).isNull();
    }

    @Test
    void maxItemsPerRun이_0이면_예외() {
        assertThatThrownBy(() -> new StatusReporterConfig(0, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("maxItemsPerRun must be positive (current: 0)");
    }

    @Test
    void perRunEstimate가_음수면_예외() {
        assertThatThrownBy(() -> new StatusReporterConfig(100, Duration.ofMinutes(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("perRunEstimate must not be negative");
    }

    @Test
    void with_메서드는_해당_값만_변경() {
        StatusReporterConfig config = new StatusReporterConfig()
            .withMaxItemsPerRun(50)
            .withPerRunEstimate(Duration.ofHours(2));

        assertThat(config).isEqualTo(new StatusReporterConfig(50, Duration.ofHours(2)));
    }
}
