package com.ryuqq.conductor.core.collaborator;

import com.ryuqq.conductor.core.error.CollaboratorException;

/**
 * Port of the external release tool ({@code semantic-release}).
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface ReleaseToolClient {

    /**
     * Checks that the tool is installed.
     *
     * @return reported tool version
     * @throws CollaboratorException if the tool is missing or cannot be started
     */
    String version() throws CollaboratorException;

    /**
     * Runs a release.
     *
     * @param dryRun true to only compute the next version without publishing
     * @return tool result, including non-zero exits
     * @throws CollaboratorException if the tool cannot be started or times out
     */
    ToolResult run(boolean dryRun) throws CollaboratorException;
}
