package com.ryuqq.conductor.core.error;

/**
 * Expected failure of a worker step.
 *
 * <p>The worker harness reports the message of these exceptions verbatim as the operation's
 * failure message. Anything else thrown by a step is treated either as a plain checked error
 * (message kept) or as a programming error (reported as {@code "internal error"}).</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public abstract class StepFailureException extends Exception {

    protected StepFailureException(String message) {
        super(requireMessage(message));
    }

    protected StepFailureException(String message, Throwable cause) {
        super(requireMessage(message), cause);
    }

    private static String requireMessage(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        return message;
    }
}
