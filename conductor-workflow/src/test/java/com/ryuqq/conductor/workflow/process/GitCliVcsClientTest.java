package com.ryuqq.conductor.workflow.process;

import com.ryuqq.conductor.core.collaborator.CommitInfo;
import com.ryuqq.conductor.core.collaborator.ToolResult;
import com.ryuqq.conductor.core.error.CollaboratorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * GitCliVcsClient 유닛 테스트 (ProcessRunner mock).
 *
 * @author Conductor Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class GitCliVcsClientTest {

    private static final List<String> DESCRIBE = List.of("git", "describe", "--tags", "--abbrev=0");

    @Mock
    private ProcessRunner runner;

    private GitCliVcsClient client;

    @BeforeEach
    void setUp() {
        client = new GitCliVcsClient(runner);
    }

    @Test
    void getLastTag_태그가_있으면_반환함() throws Exception {
        // given
        when(runner.run("git", DESCRIBE)).thenReturn(new ToolResult(0, "v1.2.0\n", ""));

        // when & then
        assertThat(client.getLastTag()).contains("v1.2.0");
    }

    @Test
    void getLastTag_태그가_없으면_empty() throws Exception {
        // given
        when(runner.run("git", DESCRIBE))
            .thenReturn(new ToolResult(128, "", "fatal: No names found, cannot describe anything."));

        // when & then
        assertThat(client.getLastTag()).isEmpty();
    }

    @Test
    void getCommitsSince_범위를_지정하고_log_출력을_해석함() throws Exception {
        // given
        String output = "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa\u001fAna\u001fana@example.com\u001f"
            + "2024-06-01T14:00:00+02:00\u001ffeat: add export\u001fLong body\nsecond line\n\u001e\n"
            + "bbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb\u001fLuis\u001fluis@example.com\u001f"
            + "2024-05-31T09:30:00Z\u001ffix: null check\u001f\u001e\n";
        when(runner.run("git", List.of("git", "log", "--no-merges", GitCliVcsClient.LOG_FORMAT, "v1.2.0..HEAD")))
            .thenReturn(new ToolResult(0, output, ""));

        // when
        List<CommitInfo> commits = client.getCommitsSince("v1.2.0");

        // then
        assertThat(commits).hasSize(2);
        assertThat(commits.get(0).authorName()).isEqualTo("Ana");
        assertThat(commits.get(0).committedAt()).isEqualTo(Instant.parse("2024-06-01T12:00:00Z"));
        assertThat(commits.get(0).subject()).isEqualTo("feat: add export");
        assertThat(commits.get(0).body()).isEqualTo("Long body\nsecond line");
        assertThat(commits.get(1).shortHash()).isEqualTo("bbbbbbb");
        assertThat(commits.get(1).body()).isEmpty();
    }

    @Test
    void getCommitsSince_기준이_없으면_HEAD_전체() throws Exception {
        // given
        when(runner.run("git", List.of("git", "log", "--no-merges", GitCliVcsClient.LOG_FORMAT, "HEAD")))
            .thenReturn(new ToolResult(0, "", ""));

        // when & then
        assertThat(client.getCommitsSince(null)).isEmpty();
    }

    @Test
    void getChanges_섹션별로_합침() throws Exception {
        // given
        when(runner.run("git", List.of("git", "diff", "--cached"))).thenReturn(new ToolResult(0, "+staged", ""));
        when(runner.run("git", List.of("git", "diff"))).thenReturn(new ToolResult(0, "", ""));
        when(runner.run("git", List.of("git", "ls-files", "--others", "--exclude-standard")))
            .thenReturn(new ToolResult(0, "notes.txt\nsrc/New.java\n", ""));

        // when
        String changes = client.getChanges();

        // then
        assertThat(changes).isEqualTo("=== STAGED CHANGES ===\n+staged\n\n"
            + "=== UNTRACKED FILES ===\nNew file: notes.txt\nNew file: src/New.java\n");
    }

    @Test
    void getChanges_깨끗한_작업트리는_빈_문자열() throws Exception {
        // given
        when(runner.run(eq("git"), anyList())).thenReturn(new ToolResult(0, "", ""));

        // when & then
        assertThat(client.getChanges()).isEmpty();
    }

    @Test
    void git_실패는_stderr를_메시지로_하는_CollaboratorException() throws Exception {
        // given
        when(runner.run("git", List.of("git", "diff", "--cached")))
            .thenReturn(new ToolResult(128, "", "fatal: not a git repository (or any of the parent directories): .git\n"));

        // when & then
        assertThatThrownBy(() -> client.getChanges())
            .isInstanceOf(CollaboratorException.class)
            .hasMessage("fatal: not a git repository (or any of the parent directories): .git");
    }

    @Test
    void parseLog_형식이_맞지_않으면_CollaboratorException() {
        assertThatThrownBy(() -> GitCliVcsClient.parseLog("garbage\u001e"))
            .isInstanceOf(CollaboratorException.class)
            .hasMessageContaining("Unexpected git log record");
    }
}
