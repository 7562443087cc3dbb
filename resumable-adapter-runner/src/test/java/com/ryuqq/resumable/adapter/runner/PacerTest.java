package com.ryuqq.resumable.adapter.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PacerTest {

    @Test
    void 대기_시간이_0이면_즉시_반환() {
        long started = System.nanoTime();

        Pacer.threadSleep().pause(Duration.ZERO);

        assertThat(System.nanoTime() - started).isLessThan(Duration.ofSeconds(1).toNanos());
    }

    @Test
    void 인터럽트되면_플래그를_복원하고_RuntimeException() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> Pacer.threadSleep().pause(Duration.ofSeconds(5)))
                .isInstanceOf(RuntimeException.class)
                .hasMessage("Inter-item delay interrupted")
                .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
