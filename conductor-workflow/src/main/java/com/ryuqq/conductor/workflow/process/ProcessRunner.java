package com.ryuqq.conductor.workflow.process;

import com.ryuqq.conductor.core.collaborator.ToolResult;
import com.ryuqq.conductor.core.error.CollaboratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an external command in a working directory and captures its output.
 *
 * <p>stdout and stderr are drained concurrently on dedicated daemon threads so a chatty
 * process cannot block on a full pipe, and concurrent runs never wait on a shared pool. A process that outlives {@code timeout} is killed and reported as a collaborator
 * failure.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private static final Executor STREAM_DRAINS = Executors.newCachedThreadPool(new DrainThreadFactory());

    private final Path workingDir;
    private final Duration timeout;
    private final Executor drains;

    public ProcessRunner(Path workingDir, Duration timeout) {
        this(workingDir, timeout, STREAM_DRAINS);
    }

    ProcessRunner(Path workingDir, Duration timeout, Executor drains) {
        if (workingDir == null) {
            throw new IllegalArgumentException("workingDir cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (drains == null) {
            throw new IllegalArgumentException("drains cannot be null");
        }
        this.workingDir = workingDir;
        this.timeout = timeout;
        this.drains = drains;
    }

    /**
     * @param collaborator name used in failure reports
     * @param command program and arguments
     * @return exit code and captured output; a non-zero exit is not an error here
     * @throws CollaboratorException if the process cannot be started, times out or is interrupted
     */
    public ToolResult run(String collaborator, List<String> command) throws CollaboratorException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be null or empty");
        }
        log.debug("Running {} in {}", command, workingDir);

        Process process;
        try {
            process = new ProcessBuilder(command).directory(workingDir.toFile()).start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw new CollaboratorException(collaborator,
                "Failed to execute " + command.get(0) + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> read(process.getInputStream()), drains);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()), drains);
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CollaboratorException(collaborator,
                    command.get(0) + " timed out after " + timeout.toMillis() + "ms");
            }
            return new ToolResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new CollaboratorException(collaborator, command.get(0) + " was interrupted", e);
        } catch (ExecutionException e) {
            throw new CollaboratorException(collaborator,
                "Failed to read output of " + command.get(0) + ": " + e.getCause().getMessage(), e.getCause());
        }
    }

    public Path workingDir() {
        return workingDir;
    }

    private static String read(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Daemon threads named "conductor-process-drain-{n}".
     */
    private static final class DrainThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "conductor-process-drain-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
