/**
 * Contract Test suites for store adapters.
 *
 * <p>Each suite is abstract. An adapter module subclasses it in its own test sources and
 * implements {@link com.ryuqq.resumable.testkit.contract.AbstractContractTest#createCheckpointStore()}
 * and {@link com.ryuqq.resumable.testkit.contract.AbstractContractTest#createResultStore()}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.testkit.contract;
