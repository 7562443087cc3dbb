/**
 * Status query use case.
 *
 * <p>{@link com.ryuqq.resumable.application.status.StatusReporter} joins checkpoint and
 * result state into a {@link com.ryuqq.resumable.application.status.ProgressSnapshot}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.application.status;
