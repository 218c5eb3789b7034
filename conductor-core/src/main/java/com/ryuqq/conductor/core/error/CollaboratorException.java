package com.ryuqq.conductor.core.error;

/**
 * An external collaborator (VCS, AI provider, release tool, filesystem) failed.
 *
 * <p>Typically transient: network blips, rate limits, a tool exiting non-zero. The harness
 * reports it as a failure and leaves any retry to the user starting the operation again;
 * retry and fallback inside a provider belong to the collaborator itself.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class CollaboratorException extends StepFailureException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super(message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    /**
     * Short name of the failing collaborator, used for diagnostics (e.g. "git", "ai").
     *
     * @return collaborator name
     */
    public String getCollaborator() {
        return collaborator;
    }
}
