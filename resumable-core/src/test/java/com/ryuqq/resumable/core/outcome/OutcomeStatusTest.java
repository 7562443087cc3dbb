package com.ryuqq.resumable.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OutcomeStatus Enum 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class OutcomeStatusTest {

    @Test
    void fromWireName_KnownNames_AreResolvedCaseInsensitively() {
        assertEquals(OutcomeStatus.SUCCEEDED, OutcomeStatus.fromWireName("succeeded"));
        assertEquals(OutcomeStatus.FAILED, OutcomeStatus.fromWireName("FAILED"));
    }

    @Test
    void fromWireName_UnknownName_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OutcomeStatus.fromWireName("retry")
        );
        assertTrue(exception.getMessage().contains("Unknown outcome status"));
    }
}
