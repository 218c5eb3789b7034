package com.ryuqq.conductor.testkit.fake;

import com.ryuqq.conductor.core.collaborator.CommitInfo;
import com.ryuqq.conductor.core.collaborator.VcsClient;
import com.ryuqq.conductor.core.error.CollaboratorException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link VcsClient} with fixed answers.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class ScriptedVcsClient implements VcsClient {

    private volatile String changes = "";
    private volatile String lastTag;
    private final List<CommitInfo> commits = new CopyOnWriteArrayList<>();
    private volatile CollaboratorException failure;
    private final List<String> requestedSinceRefs = new CopyOnWriteArrayList<>();

    public ScriptedVcsClient withChanges(String diff) {
        this.changes = diff;
        return this;
    }

    public ScriptedVcsClient withLastTag(String tag) {
        this.lastTag = tag;
        return this;
    }

    public ScriptedVcsClient withCommit(String subject) {
        return withCommit(subject, "");
    }

    public ScriptedVcsClient withCommit(String subject, String body) {
        String hash = String.format("%040x", commits.size() + 1L);
        commits.add(new CommitInfo(hash, "Dev", "dev@example.com",
            Instant.parse("2024-06-01T12:00:00Z"), subject, body));
        return this;
    }

    /**
     * Every call fails with the given exception.
     */
    public ScriptedVcsClient failingWith(CollaboratorException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public String getChanges() throws CollaboratorException {
        failIfScripted();
        return changes;
    }

    @Override
    public Optional<String> getLastTag() throws CollaboratorException {
        failIfScripted();
        return Optional.ofNullable(lastTag);
    }

    @Override
    public List<CommitInfo> getCommitsSince(String sinceRef) throws CollaboratorException {
        failIfScripted();
        requestedSinceRefs.add(String.valueOf(sinceRef));
        return new ArrayList<>(commits);
    }

    public List<String> requestedSinceRefs() {
        return new ArrayList<>(requestedSinceRefs);
    }

    private void failIfScripted() throws CollaboratorException {
        CollaboratorException current = failure;
        if (current != null) {
            throw current;
        }
    }
}
