package com.ryuqq.resumable.testkit.extraction;

import com.ryuqq.resumable.adapter.runner.Pacer;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pacer that never sleeps and records the requested pauses.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RecordingPacer implements Pacer {

    private final List<Duration> pauses = new CopyOnWriteArrayList<>();

    @Override
    public void pause(Duration duration) {
        pauses.add(duration);
    }

    public List<Duration> pauses() {
        return Collections.unmodifiableList(pauses);
    }

    public Duration totalPaused() {
        Duration total = Duration.ZERO;
        for (Duration pause : pauses) {
            total = total.plus(pause);
        }
        return total;
    }
}
