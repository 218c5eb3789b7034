package com.ryuqq.conductor.workflow.process;

import com.ryuqq.conductor.core.collaborator.ReleaseToolClient;
import com.ryuqq.conductor.core.collaborator.ToolResult;
import com.ryuqq.conductor.core.error.CollaboratorException;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ReleaseToolClient} that invokes {@code semantic-release} through {@code npx}.
 *
 * <p>On Windows the command goes through {@code cmd /C} because {@code npx} is a batch script there.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class NpxReleaseToolClient implements ReleaseToolClient {

    static final String COLLABORATOR = "semantic-release";
    static final String NOT_INSTALLED =
        "semantic-release is not installed. Install it with: npm install -g semantic-release";

    private final ProcessRunner runner;
    private final boolean windows;

    public NpxReleaseToolClient(ProcessRunner runner) {
        this(runner, System.getProperty("os.name", "").startsWith("Windows"));
    }

    NpxReleaseToolClient(ProcessRunner runner, boolean windows) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        this.runner = runner;
        this.windows = windows;
    }

    @Override
    public String version() throws CollaboratorException {
        ToolResult result;
        try {
            result = runner.run(COLLABORATOR, command("--version"));
        } catch (CollaboratorException e) {
            throw new CollaboratorException(COLLABORATOR, NOT_INSTALLED, e);
        }
        if (!result.isSuccess() || result.stdout().isBlank()) {
            throw new CollaboratorException(COLLABORATOR, NOT_INSTALLED);
        }
        return result.stdout().trim();
    }

    @Override
    public ToolResult run(boolean dryRun) throws CollaboratorException {
        return dryRun ? runner.run(COLLABORATOR, command("--dry-run")) : runner.run(COLLABORATOR, command());
    }

    List<String> command(String... args) {
        List<String> command = new ArrayList<>();
        if (windows) {
            command.add("cmd");
            command.add("/C");
        }
        command.add("npx");
        command.add("semantic-release");
        command.addAll(List.of(args));
        return command;
    }
}
