/**
 * Immutable status snapshots returned by {@code getStatus()}.
 *
 * <p>{@link com.ryuqq.conductor.core.status.OperationStatus} is a sealed interface; the five
 * record implementations mirror {@link com.ryuqq.conductor.core.statemachine.OperationState}
 * and add the data the UI renders (progress message, result, failure message).</p>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.status;
