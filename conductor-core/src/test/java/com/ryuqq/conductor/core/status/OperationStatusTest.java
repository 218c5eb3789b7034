package com.ryuqq.conductor.core.status;

import com.ryuqq.conductor.core.statemachine.OperationState;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OperationStatus 변형 테스트.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class OperationStatusTest {

    @Test
    void state_EachVariant_MapsToMatchingState() {
        // When & Then
        assertEquals(OperationState.PENDING, new Pending().state());
        assertEquals(OperationState.RUNNING, new Running("Starting", Instant.now()).state());
        assertEquals(OperationState.COMPLETED, new Completed("done").state());
        assertEquals(OperationState.FAILED, new Failed("boom").state());
        assertEquals(OperationState.CANCELLED, new Cancelled().state());
    }

    @Test
    void isTerminal_DelegatesToState() {
        assertFalse(new Pending().isTerminal());
        assertFalse(new Running("", Instant.now()).isTerminal());
        assertTrue(new Completed("").isTerminal());
        assertTrue(new Failed("x").isTerminal());
        assertTrue(new Cancelled().isTerminal());
    }

    @Test
    void withMessage_KeepsStartTime() {
        // Given
        Instant startedAt = Instant.parse("2024-01-01T00:00:00Z");
        Running running = new Running("Connecting...", startedAt);

        // When
        Running updated = running.withMessage("Generating...");

        // Then
        assertEquals("Generating...", updated.message());
        assertEquals(startedAt, updated.startedAt());
    }

    @Test
    void failed_BlankMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Failed(" "));
        assertThrows(IllegalArgumentException.class, () -> new Failed(null));
    }

    @Test
    void completed_NullResult_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Completed(null));
        assertDoesNotThrow(() -> new Completed(""));
    }
}
