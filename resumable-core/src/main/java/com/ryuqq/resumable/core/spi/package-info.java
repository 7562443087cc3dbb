/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the persistence interfaces that infrastructure adapters implement
 * to give the engine durable state.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resumable.core.spi.CheckpointStore} - Atomic checkpoint replace/load</li>
 *   <li>{@link com.ryuqq.resumable.core.spi.ResultStore} - Idempotent append-only outcome log</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (resumable-adapter-inmemory, resumable-adapter-file) provide concrete
 * implementations. Every implementation should pass the contract suites in resumable-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Single Writer:</strong> Stores assume one active run at a time</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.resumable.core.spi;
