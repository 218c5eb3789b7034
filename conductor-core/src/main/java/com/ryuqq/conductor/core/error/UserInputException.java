package com.ryuqq.conductor.core.error;

/**
 * The user asked for something that cannot be done with the current input
 * (for example "nothing to analyze"). Reported immediately, never retried.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class UserInputException extends StepFailureException {

    public UserInputException(String message) {
        super(message);
    }
}
