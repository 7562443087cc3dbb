package com.ryuqq.resumable.adapter.runner;

import com.ryuqq.resumable.application.orchestrator.RunReport;
import com.ryuqq.resumable.application.trigger.ChainDecision;
import com.ryuqq.resumable.application.trigger.RunTrigger;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@code hasMoreWork}가 true인 동안 다음 실행을 연결하는 RunTrigger.
 *
 * <p>maxChainedRuns를 지정하면 그 횟수만큼 CHAIN을 결정한 뒤에는
 * 남은 작업이 있어도 STOP을 반환합니다. 0은 제한 없음입니다.</p>
 *
 * <p>CHAIN 횟수를 세므로 인스턴스 하나를 하나의 작업 체인에만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HasMoreWorkTrigger implements RunTrigger {

    private final int maxChainedRuns;
    private final AtomicInteger chained = new AtomicInteger();

    /**
     * 제한 없이 연결하는 Trigger 생성.
     */
    public HasMoreWorkTrigger() {
        this(0);
    }

    /**
     * 생성자.
     *
     * @param maxChainedRuns 최대 CHAIN 횟수 (0이면 제한 없음)
     * @throws IllegalArgumentException maxChainedRuns가 음수인 경우
     */
    public HasMoreWorkTrigger(int maxChainedRuns) {
        if (maxChainedRuns < 0) {
            throw new IllegalArgumentException(
                "maxChainedRuns must not be negative (current: " + maxChainedRuns + ")"
            );
        }
        this.maxChainedRuns = maxChainedRuns;
    }

    @Override
    public ChainDecision decide(RunReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        if (!report.hasMoreWork()) {
            return ChainDecision.STOP;
        }
        if (maxChainedRuns > 0 && chained.get() >= maxChainedRuns) {
            return ChainDecision.STOP;
        }
        chained.incrementAndGet();
        return ChainDecision.CHAIN;
    }

    /**
     * 지금까지 CHAIN을 결정한 횟수.
     *
     * @return CHAIN 횟수
     */
    public int chainedRuns() {
        return chained.get();
    }
}
