package com.ryuqq.conductor.workflow.operation;

import com.ryuqq.conductor.core.config.ConductorSettings;
import com.ryuqq.conductor.core.error.CollaboratorException;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.status.Completed;
import com.ryuqq.conductor.core.status.Failed;
import com.ryuqq.conductor.core.status.OperationStatus;
import com.ryuqq.conductor.testkit.fake.RecordingArtifactStore;
import com.ryuqq.conductor.testkit.fake.ScriptedAiClient;
import com.ryuqq.conductor.testkit.fake.ScriptedVcsClient;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ReleaseNotesOperation 테스트.
 *
 * <p>구조화 문서 저장, AI 다듬기, AI 실패 시 비치명적 완료를 검증합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class ReleaseNotesOperationTest {

    private static final String STRUCTURED = "release-notes/release-notes-2024-06-01_STRUCTURED.md";
    private static final String POLISHED = "release-notes/release-notes-2024-06-01_AI.md";

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T10:15:30Z"), ZoneOffset.UTC);
    private final ScriptedVcsClient vcs = new ScriptedVcsClient();
    private final ScriptedAiClient ai = new ScriptedAiClient();
    private final RecordingArtifactStore store = new RecordingArtifactStore(Path.of("workspace"));
    private final OperationParams params = OperationParams.of(new ConductorSettings());

    private ReleaseNotesOperation operation() {
        return new ReleaseNotesOperation(vcs, ai, store, clock);
    }

    @Test
    void 구조화_문서와_AI_문서를_저장하고_완료함() throws Exception {
        // given
        vcs.withLastTag("v1.2.0")
            .withCommit("feat(auth): add token refresh", "BREAKING CHANGE: tokens expire after 1h")
            .withCommit("fix: handle empty diff");
        ai.thenReply("# Release 1.3.0\n\nPolished notes");

        // when
        OperationRuns.Result result = OperationRuns.run(operation(), params);

        // then
        assertThat(result.status()).isEqualTo(new Completed(
            "Release notes saved to " + Path.of("workspace").resolve(POLISHED)
                + " (structured data: " + Path.of("workspace").resolve(STRUCTURED) + ")"));
        assertThat(store.artifacts()).containsOnlyKeys(STRUCTURED, POLISHED);
        assertThat(store.artifacts().get(STRUCTURED))
            .contains("- **Previous release**: v1.2.0")
            .contains("### New Features (1)")
            .contains("### Bug Fixes (1)")
            .contains("## Breaking Changes")
            .contains("tokens expire after 1h");
        assertThat(store.artifacts().get(POLISHED)).isEqualTo("# Release 1.3.0\n\nPolished notes");
        assertThat(vcs.requestedSinceRefs()).containsExactly("v1.2.0");
        assertThat(ai.prompts().get(0)).contains("### New Features (1)");
        assertThat(result.progressTexts()).containsExactly(
            "Getting commits since last release...",
            "Found 2 commits since v1.2.0",
            "Writing structured release notes...",
            "Generating release notes with AI..."
        );
    }

    @Test
    void 태그가_없으면_전체_이력을_사용함() throws Exception {
        // given
        vcs.withCommit("chore: initial commit");
        ai.thenReply("notes");

        // when
        OperationStatus status = OperationRuns.run(operation(), params).status();

        // then
        assertThat(status).isInstanceOf(Completed.class);
        assertThat(vcs.requestedSinceRefs()).containsExactly("null");
        assertThat(store.artifacts().get(STRUCTURED))
            .contains("- **Previous release**: none")
            .contains("### Other Changes (1)");
    }

    @Test
    void 커밋이_없으면_파일을_만들지_않고_실패함() throws Exception {
        // given
        vcs.withLastTag("v2.0.0");

        // when
        OperationStatus status = OperationRuns.run(operation(), params).status();

        // then
        assertThat(status).isEqualTo(new Failed("No commits found since the last release"));
        assertThat(store.artifacts()).isEmpty();
        assertThat(ai.prompts()).isEmpty();
    }

    @Test
    void AI_실패는_구조화_문서_경로와_함께_완료로_처리됨() throws Exception {
        // given
        vcs.withCommit("feat: new dashboard");
        ai.thenFail(new CollaboratorException("ai", "quota exceeded"));

        // when
        OperationStatus status = OperationRuns.run(operation(), params).status();

        // then
        assertThat(status).isEqualTo(new Completed(
            "Structured release notes saved to " + Path.of("workspace").resolve(STRUCTURED)
                + " (AI generation failed: quota exceeded)"));
        assertThat(store.artifacts()).containsOnlyKeys(STRUCTURED);
    }

    @Test
    void 저장_실패는_작업_실패임() throws Exception {
        // given
        vcs.withCommit("fix: typo");
        store.failingWith(new CollaboratorException("filesystem", "disk full"));

        // when
        OperationStatus status = OperationRuns.run(operation(), params).status();

        // then
        assertThat(status).isEqualTo(new Failed("disk full"));
        assertThat(ai.prompts()).isEmpty();
    }

    @Test
    void 설정의_출력_디렉터리를_사용함() throws Exception {
        // given
        vcs.withCommit("docs: update readme");
        ai.thenReply("notes");
        OperationParams custom = OperationParams.of(new ConductorSettings().withReleaseNotesDir("docs/releases"));

        // when
        OperationRuns.run(operation(), custom);

        // then
        assertThat(store.artifacts()).containsOnlyKeys(
            "docs/releases/release-notes-2024-06-01_STRUCTURED.md",
            "docs/releases/release-notes-2024-06-01_AI.md"
        );
    }
}
