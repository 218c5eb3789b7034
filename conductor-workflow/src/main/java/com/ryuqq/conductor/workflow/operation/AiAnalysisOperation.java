package com.ryuqq.conductor.workflow.operation;

import com.ryuqq.conductor.application.catalog.OperationFactory;
import com.ryuqq.conductor.core.collaborator.AiClient;
import com.ryuqq.conductor.core.collaborator.VcsClient;
import com.ryuqq.conductor.core.error.UserInputException;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.plan.OperationPlan;
import com.ryuqq.conductor.core.plan.Step;

import java.util.Optional;

/**
 * 미커밋 변경사항을 AI로 분석하는 작업 ({@link OperationKind#AI_ANALYSIS}).
 *
 * <p><strong>Step:</strong></p>
 * <ol>
 *   <li>변경사항 수집: {@code params.diff}가 있으면 사용, 없으면 {@link VcsClient#getChanges()}</li>
 *   <li>프롬프트 구성</li>
 *   <li>AI 호출 (비동기 브리지 경유), 응답 텍스트가 결과</li>
 * </ol>
 *
 * <p>변경사항이 비어 있으면 {@code UserInputException("No git changes found to analyze")}로 실패합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class AiAnalysisOperation implements OperationFactory {

    static final String NO_CHANGES = "No git changes found to analyze";

    private final VcsClient vcs;
    private final AiClient ai;

    public AiAnalysisOperation(VcsClient vcs, AiClient ai) {
        if (vcs == null) {
            throw new IllegalArgumentException("vcs cannot be null");
        }
        if (ai == null) {
            throw new IllegalArgumentException("ai cannot be null");
        }
        this.vcs = vcs;
        this.ai = ai;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.AI_ANALYSIS;
    }

    @Override
    public OperationPlan plan(OperationParams params) {
        Optional<String> providedDiff = params.get(OperationParams.DIFF);
        String language = params.settings().promptLanguage();

        return OperationPlan.of(
            Step.of("Analyzing git repository changes...", ctx -> {
                String diff = providedDiff.isPresent() ? providedDiff.get() : vcs.getChanges();
                if (diff == null || diff.isBlank()) {
                    throw new UserInputException(NO_CHANGES);
                }
                return diff;
            }),
            Step.of("Connecting to Gemini AI...", ctx ->
                Prompts.commitAnalysis(ctx.previousResult().orElse(""), language)),
            Step.of("Generating comprehensive commit analysis...", ctx -> {
                String prompt = ctx.previousResult().orElse("");
                return ctx.awaitAsync(executor -> ai.generateText(prompt, executor));
            })
        );
    }
}
