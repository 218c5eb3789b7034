package com.ryuqq.conductor.core.plan;

/**
 * One unit of work inside an {@link OperationPlan}.
 *
 * <p>The worker harness checks for cancellation before every step and publishes
 * {@link #description()} as a progress event, so a step never needs to do either itself.
 * A step returns its output as a string; the output of the last step becomes the result of
 * the operation, and every step can read its predecessor's output through
 * {@link StepContext#previousResult()}.</p>
 *
 * <p><strong>Failure contract:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.error.UserInputException} / {@link com.ryuqq.conductor.core.error.CollaboratorException}:
 *       expected failure, message shown to the user</li>
 *   <li>other checked exceptions: message shown to the user</li>
 *   <li>{@link RuntimeException} / {@link Error}: reported as {@code "internal error"}</li>
 *   <li>{@link StepCancelledException}: the operation ends as cancelled</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface Step {

    /**
     * Human readable progress text (e.g. "Analyzing git repository changes...").
     *
     * @return description, never blank
     */
    String description();

    /**
     * Executes the step on the worker thread. May block.
     *
     * @param context per-operation context
     * @return step output (may be empty, never null)
     * @throws Exception see the failure contract above
     */
    String execute(StepContext context) throws Exception;

    /**
     * Creates a step from a description and a body.
     *
     * @param description progress text
     * @param body step body
     * @return new step
     */
    static Step of(String description, Body body) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return new Step() {
            @Override
            public String description() {
                return description;
            }

            @Override
            public String execute(StepContext context) throws Exception {
                return body.run(context);
            }

            @Override
            public String toString() {
                return "Step{" + description + '}';
            }
        };
    }

    /**
     * Body of a step built with {@link #of(String, Body)}.
     */
    @FunctionalInterface
    interface Body {
        String run(StepContext context) throws Exception;
    }
}
