/**
 * Work Ledger files: reading a job's ledger and exporting failed identifiers as a new one.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.adapter.file.ledger;
