package com.ryuqq.resumable.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RunSlice Record 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RunSliceTest {

    @Test
    void empty_HasZeroSize() {
        assertEquals(0, RunSlice.EMPTY.size());
        assertTrue(RunSlice.EMPTY.isEmpty());
        assertFalse(RunSlice.EMPTY.contains(0));
        assertFalse(RunSlice.EMPTY.isLast(-1));
    }

    @Test
    void contains_And_isLast_UseInclusiveBounds() {
        // Given
        RunSlice slice = new RunSlice(100, 199);

        // Then
        assertTrue(slice.contains(100));
        assertTrue(slice.contains(199));
        assertFalse(slice.contains(200));
        assertTrue(slice.isLast(199));
        assertFalse(slice.isLast(198));
    }

    @Test
    void constructor_EndBeforeStartMinusOne_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RunSlice(5, 3));
    }

    @Test
    void constructor_NegativeStart_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RunSlice(-1, 3));
    }
}
