/**
 * Operation state machine package.
 *
 * <p>This package implements the state transition rules for the operation lifecycle.
 * The registry consults these rules on every write, so readers can never observe a
 * state regressing.</p>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → RUNNING   (worker scheduled)
 * PENDING → CANCELLED (cancelled before the worker started)
 * RUNNING → COMPLETED | FAILED | CANCELLED
 *
 * Forbidden:
 * - COMPLETED / FAILED / CANCELLED → * (terminal states)
 * - RUNNING → PENDING
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * StateTransition.isAllowed(OperationState.PENDING, OperationState.RUNNING);     // true
 * StateTransition.isAllowed(OperationState.RUNNING, OperationState.PENDING);     // false
 * StateTransition.isAllowed(OperationState.COMPLETED, OperationState.CANCELLED); // false
 * </pre>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.statemachine;
