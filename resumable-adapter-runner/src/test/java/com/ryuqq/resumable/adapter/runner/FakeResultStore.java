package com.ryuqq.resumable.adapter.runner;

import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.spi.ResultStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 테스트용 ResultStore. 식별자 기준으로 멱등 append하고 append 배치 크기를 기록합니다.
 */
final class FakeResultStore implements ResultStore {

    private final Map<String, Outcome> outcomes = new LinkedHashMap<>();
    private final List<Integer> appendedBatchSizes = new ArrayList<>();

    @Override
    public int append(List<Outcome> batch) {
        appendedBatchSizes.add(batch.size());
        int appended = 0;
        for (Outcome outcome : batch) {
            if (outcomes.putIfAbsent(outcome.id(), outcome) == null) {
                appended++;
            }
        }
        return appended;
    }

    @Override
    public List<Outcome> loadAll() {
        return List.copyOf(outcomes.values());
    }

    @Override
    public Set<String> ids() {
        return Set.copyOf(outcomes.keySet());
    }

    @Override
    public int size() {
        return outcomes.size();
    }

    @Override
    public void clear() {
        outcomes.clear();
    }

    Outcome get(String id) {
        return outcomes.get(id);
    }

    List<Integer> appendedBatchSizes() {
        return appendedBatchSizes;
    }
}
