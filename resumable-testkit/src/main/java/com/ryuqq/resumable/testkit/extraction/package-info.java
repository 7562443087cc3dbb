/**
 * Extraction and pacing doubles for orchestrator tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.testkit.extraction;
