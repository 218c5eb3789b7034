package com.ryuqq.conductor.core.collaborator;

import com.ryuqq.conductor.core.error.CollaboratorException;

import java.util.List;
import java.util.Optional;

/**
 * Version control port. Calls are blocking and run on the worker thread.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface VcsClient {

    /**
     * @return working tree changes as a unified diff (staged and unstaged), empty if clean
     */
    String getChanges() throws CollaboratorException;

    /**
     * @return most recent tag reachable from HEAD, empty if the repository has no tags
     */
    Optional<String> getLastTag() throws CollaboratorException;

    /**
     * @param sinceRef exclusive lower bound (tag or commit), null for the whole history
     * @return commits newest first
     */
    List<CommitInfo> getCommitsSince(String sinceRef) throws CollaboratorException;
}
