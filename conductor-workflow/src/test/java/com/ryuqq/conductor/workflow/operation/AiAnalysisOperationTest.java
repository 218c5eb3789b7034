package com.ryuqq.conductor.workflow.operation;

import com.ryuqq.conductor.core.config.ConductorSettings;
import com.ryuqq.conductor.core.error.CollaboratorException;
import com.ryuqq.conductor.core.event.EventPayload;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.status.Completed;
import com.ryuqq.conductor.core.status.Failed;
import com.ryuqq.conductor.testkit.fake.ScriptedAiClient;
import com.ryuqq.conductor.testkit.fake.ScriptedVcsClient;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * AiAnalysisOperation 테스트.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class AiAnalysisOperationTest {

    private final ScriptedVcsClient vcs = new ScriptedVcsClient();
    private final ScriptedAiClient ai = new ScriptedAiClient();
    private final ConductorSettings settings = new ConductorSettings().withPromptLanguage("Spanish");

    @Test
    void 변경사항을_분석하고_AI_응답으로_완료함() throws Exception {
        // given
        vcs.withChanges("diff --git a/App.java b/App.java\n+new line");
        ai.thenReply("feat(app): add new line");

        // when
        OperationRuns.Result result = OperationRuns.run(new AiAnalysisOperation(vcs, ai), OperationParams.of(settings));

        // then
        assertThat(result.status()).isEqualTo(new Completed("feat(app): add new line"));
        assertThat(result.progressTexts()).containsExactly(
            "Analyzing git repository changes...",
            "Connecting to Gemini AI...",
            "Generating comprehensive commit analysis..."
        );
        assertThat(ai.prompts()).singleElement().satisfies(prompt -> {
            assertThat(prompt).contains("+new line");
            assertThat(prompt).contains("answer in Spanish");
        });
    }

    @Test
    void diff_파라미터가_있으면_저장소를_읽지_않음() throws Exception {
        // given
        vcs.failingWith(new CollaboratorException("git", "should not be called"));
        ai.thenReply("analysis");
        OperationParams params = OperationParams.builder(settings).put(OperationParams.DIFF, "+provided").build();

        // when
        OperationRuns.Result result = OperationRuns.run(new AiAnalysisOperation(vcs, ai), params);

        // then
        assertThat(result.status()).isEqualTo(new Completed("analysis"));
        assertThat(ai.prompts().get(0)).contains("+provided");
    }

    @Test
    void 변경사항이_없으면_AI를_호출하지_않고_실패함() throws Exception {
        // given
        vcs.withChanges("   \n");

        // when
        OperationRuns.Result result = OperationRuns.run(new AiAnalysisOperation(vcs, ai), OperationParams.of(settings));

        // then
        assertThat(result.status()).isEqualTo(new Failed("No git changes found to analyze"));
        assertThat(result.events()).last().isEqualTo(new EventPayload.Failed("No git changes found to analyze"));
        assertThat(ai.prompts()).isEmpty();
    }

    @Test
    void AI_실패는_협력자_메시지로_보고됨() throws Exception {
        // given
        vcs.withChanges("+change");
        ai.thenFail(new CollaboratorException("ai", "Gemini API error: 429 Too Many Requests"));

        // when
        OperationRuns.Result result = OperationRuns.run(new AiAnalysisOperation(vcs, ai), OperationParams.of(settings));

        // then
        assertThat(result.status()).isEqualTo(new Failed("Gemini API error: 429 Too Many Requests"));
    }

    @Test
    void 저장소_오류는_git_메시지로_보고됨() throws Exception {
        // given
        vcs.failingWith(new CollaboratorException("git", "fatal: not a git repository"));

        // when
        OperationRuns.Result result = OperationRuns.run(new AiAnalysisOperation(vcs, ai), OperationParams.of(settings));

        // then
        assertThat(result.status()).isEqualTo(new Failed("fatal: not a git repository"));
    }
}
