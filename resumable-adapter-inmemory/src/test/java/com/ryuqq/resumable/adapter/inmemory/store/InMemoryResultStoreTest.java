package com.ryuqq.resumable.adapter.inmemory.store;

import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.outcome.Succeeded;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryResultStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    void 동시에_같은_식별자를_append해도_한_번만_저장() throws InterruptedException {
        // given
        InMemoryResultStore store = new InMemoryResultStore();
        List<Outcome> batch = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            batch.add(Succeeded.of("id-" + i, Map.of("n", i), NOW));
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);

        // when
        for (int t = 0; t < 4; t++) {
            pool.submit(() -> {
                start.await();
                return store.append(batch);
            });
        }
        start.countDown();
        pool.shutdown();

        // then
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(store.size()).isEqualTo(50);
    }

    @Test
    void loadAll은_스냅샷을_반환() {
        // given
        InMemoryResultStore store = new InMemoryResultStore();
        store.append(List.of(Succeeded.of("a", Map.of("t", "x"), NOW)));

        // when
        List<Outcome> snapshot = store.loadAll();
        store.append(List.of(Succeeded.of("b", Map.of("t", "y"), NOW)));

        // then
        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(null)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void append_null이면_예외() {
        assertThatThrownBy(() -> new InMemoryResultStore().append(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("batch cannot be null");
    }
}
