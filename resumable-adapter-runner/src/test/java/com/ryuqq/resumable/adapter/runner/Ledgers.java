package com.ryuqq.resumable.adapter.runner;

import com.ryuqq.resumable.core.model.WorkLedger;

import java.util.ArrayList;
import java.util.List;

final class Ledgers {

    private Ledgers() {
    }

    static WorkLedger urls(int count) {
        return range(0, count);
    }

    static WorkLedger range(int from, int count) {
        List<String> ids = new ArrayList<>();
        for (int i = from; i < from + count; i++) {
            ids.add(url(i));
        }
        return WorkLedger.of(ids);
    }

    static String url(int n) {
        return "https://example.com/item/" + n;
    }
}
