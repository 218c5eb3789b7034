package com.ryuqq.conductor.core.plan;

import com.ryuqq.conductor.core.model.OperationId;

/**
 * Thrown inside a step when cancellation was observed mid-step
 * (by {@link StepContext#checkCancelled()} or while awaiting an async call).
 *
 * <p>Never reported as a failure: the harness ends the operation as cancelled.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class StepCancelledException extends Exception {

    public StepCancelledException(OperationId operationId) {
        super("Operation cancelled: " + operationId);
    }
}
