/**
 * In-memory store implementations.
 *
 * <p>Reference implementations of the CheckpointStore and ResultStore SPIs, used by
 * tests and by callers that do not need progress to survive the process.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.adapter.inmemory.store;
