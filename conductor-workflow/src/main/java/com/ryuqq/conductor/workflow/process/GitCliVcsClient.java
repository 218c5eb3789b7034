package com.ryuqq.conductor.workflow.process;

import com.ryuqq.conductor.core.collaborator.CommitInfo;
import com.ryuqq.conductor.core.collaborator.ToolResult;
import com.ryuqq.conductor.core.collaborator.VcsClient;
import com.ryuqq.conductor.core.error.CollaboratorException;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link VcsClient} backed by the {@code git} command line.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class GitCliVcsClient implements VcsClient {

    static final String COLLABORATOR = "git";

    private static final char FIELD_SEPARATOR = '\u001f';
    private static final char RECORD_SEPARATOR = '\u001e';
    static final String LOG_FORMAT = "--format=%H%x1f%an%x1f%ae%x1f%aI%x1f%s%x1f%b%x1e";

    private final ProcessRunner runner;

    public GitCliVcsClient(ProcessRunner runner) {
        if (runner == null) {
            throw new IllegalArgumentException("runner cannot be null");
        }
        this.runner = runner;
    }

    /**
     * Staged diff, unstaged diff and untracked files, each under its own heading.
     *
     * @return empty string when the working tree is clean
     */
    @Override
    public String getChanges() throws CollaboratorException {
        StringBuilder changes = new StringBuilder();

        String staged = git("diff", "--cached");
        if (!staged.isBlank()) {
            changes.append("=== STAGED CHANGES ===\n").append(staged).append("\n\n");
        }

        String unstaged = git("diff");
        if (!unstaged.isBlank()) {
            changes.append("=== UNSTAGED CHANGES ===\n").append(unstaged).append("\n\n");
        }

        String untracked = git("ls-files", "--others", "--exclude-standard");
        if (!untracked.isBlank()) {
            changes.append("=== UNTRACKED FILES ===\n");
            for (String file : untracked.split("\\R")) {
                if (!file.isBlank()) {
                    changes.append("New file: ").append(file.trim()).append('\n');
                }
            }
        }
        return changes.toString();
    }

    /**
     * @return empty when the repository has no tags yet
     */
    @Override
    public Optional<String> getLastTag() throws CollaboratorException {
        ToolResult result = runner.run(COLLABORATOR, List.of("git", "describe", "--tags", "--abbrev=0"));
        if (!result.isSuccess()) {
            return Optional.empty();
        }
        String tag = result.stdout().trim();
        return tag.isEmpty() ? Optional.empty() : Optional.of(tag);
    }

    /**
     * Non-merge commits reachable from HEAD but not from {@code sinceRef}, newest first.
     *
     * @param sinceRef exclusive lower bound, or null for the whole history
     */
    @Override
    public List<CommitInfo> getCommitsSince(String sinceRef) throws CollaboratorException {
        String range = sinceRef == null || sinceRef.isBlank() ? "HEAD" : sinceRef + "..HEAD";
        return parseLog(git("log", "--no-merges", LOG_FORMAT, range));
    }

    static List<CommitInfo> parseLog(String output) throws CollaboratorException {
        List<CommitInfo> commits = new ArrayList<>();
        for (String record : output.split(String.valueOf(RECORD_SEPARATOR))) {
            String trimmed = stripLeadingNewlines(record);
            if (trimmed.isBlank()) {
                continue;
            }
            String[] fields = trimmed.split(String.valueOf(FIELD_SEPARATOR), -1);
            if (fields.length < 6) {
                throw new CollaboratorException(COLLABORATOR, "Unexpected git log record: " + trimmed);
            }
            try {
                commits.add(new CommitInfo(
                    fields[0],
                    fields[1],
                    fields[2],
                    OffsetDateTime.parse(fields[3]).toInstant(),
                    fields[4],
                    fields[5].trim()
                ));
            } catch (DateTimeParseException e) {
                throw new CollaboratorException(COLLABORATOR, "Unexpected commit date: " + fields[3], e);
            }
        }
        return commits;
    }

    private String git(String... args) throws CollaboratorException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        ToolResult result = runner.run(COLLABORATOR, command);
        if (!result.isSuccess()) {
            String reason = result.stderr().isBlank()
                ? "git " + args[0] + " exited with code " + result.exitCode()
                : result.stderr().trim();
            throw new CollaboratorException(COLLABORATOR, reason);
        }
        return result.stdout();
    }

    private static String stripLeadingNewlines(String value) {
        int start = 0;
        while (start < value.length() && (value.charAt(start) == '\n' || value.charAt(start) == '\r')) {
            start++;
        }
        return value.substring(start);
    }
}
