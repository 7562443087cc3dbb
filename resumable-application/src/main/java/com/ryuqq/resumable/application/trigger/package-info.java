/**
 * Run Trigger integration surface.
 *
 * <p>Keeps the engine decoupled from any scheduler: the engine emits
 * {@code hasMoreWork}, a {@link com.ryuqq.resumable.application.trigger.RunTrigger}
 * turns it into a {@link com.ryuqq.resumable.application.trigger.ChainDecision}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.application.trigger;
