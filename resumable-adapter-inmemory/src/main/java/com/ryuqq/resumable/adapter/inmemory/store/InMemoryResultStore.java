package com.ryuqq.resumable.adapter.inmemory.store;

import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.spi.ResultStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory implementation of {@link ResultStore} for testing and reference purposes.
 *
 * <p>Outcomes are kept in a {@link LinkedHashMap} keyed by identifier, which gives
 * insertion order for {@link #loadAll()} and the idempotent append for free.
 * All methods synchronize on the store so an append is atomic with respect to readers.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryResultStore implements ResultStore {

    private final Map<String, Outcome> outcomes = new LinkedHashMap<>();

    @Override
    public synchronized int append(List<Outcome> batch) {
        if (batch == null) {
            throw new IllegalArgumentException("batch cannot be null");
        }
        int appended = 0;
        for (Outcome outcome : batch) {
            if (outcomes.putIfAbsent(outcome.id(), outcome) == null) {
                appended++;
            }
        }
        return appended;
    }

    @Override
    public synchronized List<Outcome> loadAll() {
        return List.copyOf(outcomes.values());
    }

    @Override
    public synchronized Set<String> ids() {
        return Set.copyOf(outcomes.keySet());
    }

    @Override
    public synchronized int size() {
        return outcomes.size();
    }

    @Override
    public synchronized void clear() {
        outcomes.clear();
    }
}
