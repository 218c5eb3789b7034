package com.ryuqq.conductor.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OperationId Value Object 테스트.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class OperationIdTest {

    @Test
    void of_ValidValue_CreatesOperationId() {
        // Given
        String value = "op-release_notes-1";

        // When
        OperationId id = OperationId.of(value);

        // Then
        assertEquals(value, id.getValue());
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OperationId.of("  ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> OperationId.of(null));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OperationId.of(value)
        );
        assertTrue(exception.getMessage().contains("cannot exceed 255"));
    }

    @Test
    void of_MaxLengthValue_CreatesOperationId() {
        // When & Then
        assertDoesNotThrow(() -> OperationId.of("a".repeat(255)));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OperationId.of("op id!")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void generate_CalledRepeatedly_ReturnsUniqueIds() {
        // Given
        Set<OperationId> ids = new HashSet<>();

        // When
        for (int i = 0; i < 1000; i++) {
            ids.add(OperationId.generate());
        }

        // Then
        assertEquals(1000, ids.size());
    }

    @Test
    void equals_SameValue_AreEqual() {
        // Given
        OperationId first = OperationId.of("op-1");
        OperationId second = OperationId.of("op-1");

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, OperationId.of("op-2"));
    }

    @Test
    void toString_ContainsValue() {
        // When & Then
        assertEquals("OperationId{op-1}", OperationId.of("op-1").toString());
    }
}
