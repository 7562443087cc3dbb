package com.ryuqq.resumable.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checkpoint Record 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CheckpointTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void empty_HasNoProgress() {
        // When
        Checkpoint checkpoint = Checkpoint.empty();

        // Then
        assertEquals(-1, checkpoint.lastIndex());
        assertEquals(0, checkpoint.nextIndex());
        assertTrue(checkpoint.processedIds().isEmpty());
        assertNull(checkpoint.updatedAt());
        assertTrue(checkpoint.isEmpty());
    }

    @Test
    void constructor_LastIndexBelowMinusOne_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Checkpoint(-2, Set.of(), NOW)
        );
        assertTrue(exception.getMessage().contains("lastIndex must be >= -1"));
    }

    @Test
    void constructor_NullProcessedIds_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new Checkpoint(0, null, NOW));
    }

    @Test
    void processedIds_IsUnmodifiable() {
        // Given
        Checkpoint checkpoint = new Checkpoint(1, Set.of("a", "b"), NOW);

        // When & Then
        assertThrows(UnsupportedOperationException.class, () -> checkpoint.processedIds().add("c"));
    }

    @Test
    void advance_MergesIdsAndMovesIndex() {
        // Given
        Checkpoint checkpoint = Checkpoint.empty().advance(4, List.of("a", "b"), NOW);

        // When
        Checkpoint advanced = checkpoint.advance(9, List.of("c"), NOW.plusSeconds(5));

        // Then
        assertEquals(9, advanced.lastIndex());
        assertEquals(Set.of("a", "b", "c"), advanced.processedIds());
        assertEquals(NOW.plusSeconds(5), advanced.updatedAt());
        assertEquals(4, checkpoint.lastIndex(), "original checkpoint must be unchanged");
    }

    @Test
    void advance_SameIndex_IsAllowed() {
        // Given
        Checkpoint checkpoint = Checkpoint.empty().advance(3, List.of("a"), NOW);

        // When
        Checkpoint same = checkpoint.advance(3, List.of(), NOW.plusSeconds(1));

        // Then
        assertEquals(3, same.lastIndex());
        assertEquals(Set.of("a"), same.processedIds());
    }

    @Test
    void advance_BackwardsIndex_ThrowsException() {
        // Given
        Checkpoint checkpoint = Checkpoint.empty().advance(10, List.of("a"), NOW);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> checkpoint.advance(9, List.of("b"), NOW)
        );
        assertTrue(exception.getMessage().contains("cannot move backwards"));
    }

    @Test
    void withProcessed_AddsIdsWithoutMovingIndex() {
        // Given
        Checkpoint checkpoint = Checkpoint.empty().advance(2, List.of("a"), NOW);

        // When
        Checkpoint merged = checkpoint.withProcessed(List.of("x", "y"));

        // Then
        assertEquals(2, merged.lastIndex());
        assertEquals(NOW, merged.updatedAt());
        assertTrue(merged.isProcessed("x"));
        assertTrue(merged.isProcessed("a"));
    }

    @Test
    void withProcessed_NothingNew_ReturnsSameInstance() {
        // Given
        Checkpoint checkpoint = Checkpoint.empty().advance(2, List.of("a", "b"), NOW);

        // When
        Checkpoint merged = checkpoint.withProcessed(List.of("b"));

        // Then
        assertSame(checkpoint, merged);
    }
}
