package com.ryuqq.conductor.core.collaborator;

/**
 * Outcome of an external tool invocation.
 *
 * @param exitCode process exit code
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @author Conductor Team
 * @since 1.0.0
 */
public record ToolResult(int exitCode, String stdout, String stderr) {

    public ToolResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
