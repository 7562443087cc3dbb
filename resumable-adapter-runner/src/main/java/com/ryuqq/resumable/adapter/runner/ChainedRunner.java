package com.ryuqq.resumable.adapter.runner;

import com.ryuqq.resumable.application.orchestrator.BatchConfig;
import com.ryuqq.resumable.application.orchestrator.BatchOrchestrator;
import com.ryuqq.resumable.application.orchestrator.RunReport;
import com.ryuqq.resumable.application.trigger.ChainDecision;
import com.ryuqq.resumable.application.trigger.RunTrigger;
import com.ryuqq.resumable.core.model.WorkLedger;
import com.ryuqq.resumable.core.spi.CheckpointStore;
import com.ryuqq.resumable.core.spi.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 프로세스 안에서 실행을 연속으로 연결하는 Runner.
 *
 * <p>매 실행 후 {@link RunTrigger}에 다음 실행 여부를 묻고, CHAIN이면 같은 저장소로
 * {@code runOnce}를 다시 호출합니다. 실행 사이에는 어떤 상태도 메모리로 넘기지 않으며,
 * 다음 실행은 항상 저장된 Checkpoint에서 시작합니다.</p>
 *
 * <p><strong>종료 조건:</strong></p>
 * <ul>
 *   <li>Trigger가 STOP 반환</li>
 *   <li>maxRuns 도달 (경고 로그)</li>
 *   <li>runOnce 예외 (그대로 전파, 저장된 진행 상태는 유지)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ChainedRunner {

    private static final Logger log = LoggerFactory.getLogger(ChainedRunner.class);

    private final BatchOrchestrator orchestrator;
    private final RunTrigger trigger;
    private final ChainedRunnerConfig config;
    private final Pacer pacer;

    /**
     * 생성자 (Thread.sleep 대기).
     *
     * @param orchestrator 실행할 Orchestrator
     * @param trigger 다음 실행 여부 결정
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ChainedRunner(BatchOrchestrator orchestrator, RunTrigger trigger, ChainedRunnerConfig config) {
        this(orchestrator, trigger, config, Pacer.threadSleep());
    }

    /**
     * 생성자 (대기 전략 주입).
     *
     * @param orchestrator 실행할 Orchestrator
     * @param trigger 다음 실행 여부 결정
     * @param config 설정
     * @param pacer 실행 사이 대기 전략
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ChainedRunner(BatchOrchestrator orchestrator, RunTrigger trigger,
                         ChainedRunnerConfig config, Pacer pacer) {
        if (orchestrator == null) {
            throw new IllegalArgumentException("orchestrator cannot be null");
        }
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (pacer == null) {
            throw new IllegalArgumentException("pacer cannot be null");
        }
        this.orchestrator = orchestrator;
        this.trigger = trigger;
        this.config = config;
        this.pacer = pacer;
    }

    /**
     * Trigger가 STOP을 반환하거나 maxRuns에 도달할 때까지 실행.
     *
     * @param ledger Work Ledger
     * @param checkpointStore Checkpoint 저장소
     * @param resultStore Result 저장소
     * @param batchConfig 실행 설정
     * @return 실행 순서대로의 RunReport 목록 (최소 1개)
     */
    public List<RunReport> runUntilDone(WorkLedger ledger, CheckpointStore checkpointStore,
                                        ResultStore resultStore, BatchConfig batchConfig) {
        List<RunReport> reports = new ArrayList<>();

        while (true) {
            RunReport report = orchestrator.runOnce(ledger, checkpointStore, resultStore, batchConfig);
            reports.add(report);

            ChainDecision decision = trigger.decide(report);
            if (!decision.shouldChain()) {
                log.info("Chain stopped after {} run(s): lastIndex={}, hasMoreWork={}",
                    reports.size(), report.lastIndex(), report.hasMoreWork());
                break;
            }
            if (reports.size() >= config.maxRuns()) {
                log.warn("Chain reached maxRuns={} with work remaining (lastIndex={})",
                    config.maxRuns(), report.lastIndex());
                break;
            }

            log.info("Chaining run #{} from index {}", reports.size() + 1, report.lastIndex() + 1);
            pacer.pause(config.pauseBetweenRuns());
        }

        return List.copyOf(reports);
    }
}
