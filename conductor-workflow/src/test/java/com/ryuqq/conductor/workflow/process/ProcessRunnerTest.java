package com.ryuqq.conductor.workflow.process;

import com.ryuqq.conductor.core.collaborator.ToolResult;
import com.ryuqq.conductor.core.error.CollaboratorException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ProcessRunner 테스트.
 */
class ProcessRunnerTest {

    @TempDir
    Path workspace;

    @Test
    void 존재하지_않는_명령은_CollaboratorException() {
        ProcessRunner runner = new ProcessRunner(workspace, Duration.ofSeconds(5));

        assertThatThrownBy(() -> runner.run("tool", List.of("conductor-no-such-command-4711")))
            .isInstanceOf(CollaboratorException.class)
            .hasMessageStartingWith("Failed to execute conductor-no-such-command-4711");
    }

    @Test
    void 출력은_주입된_drain_executor에서_읽음() throws Exception {
        // given
        List<String> drainThreads = new CopyOnWriteArrayList<>();
        Executor drains = task -> {
            Thread thread = new Thread(() -> {
                drainThreads.add(Thread.currentThread().getName());
                task.run();
            }, "test-drain");
            thread.setDaemon(true);
            thread.start();
        };
        ProcessRunner runner = new ProcessRunner(workspace, Duration.ofSeconds(30), drains);
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();

        // when
        ToolResult result = runner.run("java", List.of(java, "-version"));

        // then
        assertThat(result.exitCode()).isZero();
        assertThat(result.stdout() + result.stderr()).contains("version");
        assertThat(drainThreads).containsExactly("test-drain", "test-drain");
    }

    @Test
    void 기본_drain_스레드는_공용_풀이_아닌_전용_데몬_스레드() throws Exception {
        // given
        ProcessRunner runner = new ProcessRunner(workspace, Duration.ofSeconds(30));
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();

        // when
        ToolResult result = runner.run("java", List.of(java, "-version"));

        // then
        assertThat(result.exitCode()).isZero();
        assertThat(Thread.getAllStackTraces().keySet())
            .filteredOn(thread -> thread.getName().startsWith("conductor-process-drain-"))
            .isNotEmpty()
            .allMatch(Thread::isDaemon);
    }

    @Test
    void 생성자_검증() {
        assertThatThrownBy(() -> new ProcessRunner(workspace, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeout must be positive");
        assertThatThrownBy(() -> new ProcessRunner(null, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProcessRunner(workspace, Duration.ofSeconds(1), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("drains cannot be null");
    }

    @Test
    void 빈_명령은_거부됨() {
        ProcessRunner runner = new ProcessRunner(workspace, Duration.ofSeconds(5));

        assertThatThrownBy(() -> runner.run("tool", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
