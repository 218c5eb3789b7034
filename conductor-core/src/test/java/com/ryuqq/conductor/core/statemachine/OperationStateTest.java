package com.ryuqq.conductor.core.statemachine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OperationState 테스트.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class OperationStateTest {

    @Test
    void isTerminal_NonTerminalStates_ReturnsFalse() {
        assertFalse(OperationState.PENDING.isTerminal());
        assertFalse(OperationState.RUNNING.isTerminal());
    }

    @Test
    void isTerminal_TerminalStates_ReturnsTrue() {
        assertTrue(OperationState.COMPLETED.isTerminal());
        assertTrue(OperationState.FAILED.isTerminal());
        assertTrue(OperationState.CANCELLED.isTerminal());
    }

    @Test
    void values_FiveStates() {
        assertEquals(5, OperationState.values().length);
    }
}
