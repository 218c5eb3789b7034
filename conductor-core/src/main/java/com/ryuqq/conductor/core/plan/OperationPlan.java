package com.ryuqq.conductor.core.plan;

import java.util.List;

/**
 * Ordered, non-empty sequence of steps executed by one worker.
 *
 * @param steps steps in execution order (copied, immutable)
 * @author Conductor Team
 * @since 1.0.0
 */
public record OperationPlan(List<Step> steps) {

    public OperationPlan {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("steps cannot be null or empty");
        }
        steps = List.copyOf(steps);
    }

    public static OperationPlan of(Step... steps) {
        if (steps == null) {
            throw new IllegalArgumentException("steps cannot be null");
        }
        return new OperationPlan(List.of(steps));
    }

    public int size() {
        return steps.size();
    }
}
