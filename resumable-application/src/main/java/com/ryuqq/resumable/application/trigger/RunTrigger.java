package com.ryuqq.resumable.application.trigger;

import com.ryuqq.resumable.application.orchestrator.RunReport;

/**
 * External mechanism that decides whether to chain the next execution.
 *
 * <p>The orchestrator's only obligation toward chaining is the {@code hasMoreWork} flag of
 * its {@link RunReport}. How the next execution is launched (a synchronous loop, a scheduled
 * job, a dispatched workflow) is up to the trigger, provided every re-invocation goes through
 * {@code runOnce} with the same checkpoint and result stores.</p>
 *
 * <p><strong>Typical Implementations:</strong></p>
 * <ul>
 *   <li>Local loop: decide, then call {@code runOnce} again in-process</li>
 *   <li>Scheduler: decide, then enqueue the next scheduled execution</li>
 *   <li>Workflow dispatch: decide, then emit a dispatch event for a fresh runner</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunTrigger {

    /**
     * Decides what happens after an execution.
     *
     * @param report the finished execution's report
     * @return CHAIN to launch another execution, STOP otherwise
     */
    ChainDecision decide(RunReport report);
}
