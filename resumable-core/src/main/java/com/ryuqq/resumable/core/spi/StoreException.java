package com.ryuqq.resumable.core.spi;

/**
 * Raised when a Checkpoint Store or Result Store cannot durably read or write its state.
 *
 * <p>A store failure is fatal to the current run: progress cannot be recorded safely,
 * so the run stops without claiming success and the last durable checkpoint remains
 * the resume point.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    /**
     * Creates a store exception with a message.
     *
     * @param message the failure description
     */
    public StoreException(String message) {
        super(message);
    }

    /**
     * Creates a store exception with a message and the underlying cause.
     *
     * @param message the failure description
     * @param cause the underlying I/O or serialization failure
     */
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
