package com.ryuqq.resumable.application.trigger;

/**
 * Decision taken by a {@link RunTrigger} after an execution finishes.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ChainDecision {

    /**
     * Launch another execution with the same stores.
     */
    CHAIN,

    /**
     * Do not launch another execution.
     */
    STOP;

    /**
     * Checks if another execution should be launched.
     *
     * @return true if this decision is CHAIN
     */
    public boolean shouldChain() {
        return this == CHAIN;
    }
}
