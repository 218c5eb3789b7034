package com.ryuqq.conductor.testkit.fake;

import com.ryuqq.conductor.core.collaborator.ReleaseToolClient;
import com.ryuqq.conductor.core.collaborator.ToolResult;
import com.ryuqq.conductor.core.error.CollaboratorException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ReleaseToolClient} with fixed answers that records every run.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class ScriptedReleaseToolClient implements ReleaseToolClient {

    private volatile String version = "23.0.0";
    private volatile CollaboratorException versionFailure;
    private volatile ToolResult result = new ToolResult(0, "", "");
    private final List<Boolean> runs = new CopyOnWriteArrayList<>();

    public ScriptedReleaseToolClient withVersion(String version) {
        this.version = version;
        return this;
    }

    public ScriptedReleaseToolClient notInstalled() {
        this.versionFailure = new CollaboratorException("semantic-release",
            "semantic-release is not installed. Install it with: npm install -g semantic-release");
        return this;
    }

    public ScriptedReleaseToolClient withResult(ToolResult result) {
        this.result = result;
        return this;
    }

    @Override
    public String version() throws CollaboratorException {
        CollaboratorException failure = versionFailure;
        if (failure != null) {
            throw failure;
        }
        return version;
    }

    @Override
    public ToolResult run(boolean dryRun) {
        runs.add(dryRun);
        return result;
    }

    /**
     * @return dry-run flag of each run, in call order
     */
    public List<Boolean> runs() {
        return new ArrayList<>(runs);
    }
}
