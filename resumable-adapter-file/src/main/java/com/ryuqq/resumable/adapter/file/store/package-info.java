/**
 * JSON file store implementations.
 *
 * <p>Jackson document classes stay package-private so the core model carries no
 * serialization annotations.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.resumable.adapter.file.store;
