package com.ryuqq.conductor.workflow.operation;

import com.ryuqq.conductor.application.catalog.OperationFactory;
import com.ryuqq.conductor.core.collaborator.ReleaseToolClient;
import com.ryuqq.conductor.core.collaborator.ToolResult;
import com.ryuqq.conductor.core.collaborator.VcsClient;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.plan.OperationPlan;
import com.ryuqq.conductor.core.plan.Step;

import java.util.Optional;

/**
 * 현재 / 다음 버전 요약 작업 ({@link OperationKind#VERSION_INFO}).
 *
 * <p>dry run의 종료 코드는 보지 않고 출력만 해석합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class VersionInfoOperation implements OperationFactory {

    static final String CURRENT_VERSION_KEY = "versionInfo.current";
    static final String COMMIT_COUNT_KEY = "versionInfo.commitCount";

    private final VcsClient vcs;
    private final ReleaseToolClient tool;

    public VersionInfoOperation(VcsClient vcs, ReleaseToolClient tool) {
        if (vcs == null) {
            throw new IllegalArgumentException("vcs cannot be null");
        }
        if (tool == null) {
            throw new IllegalArgumentException("tool cannot be null");
        }
        this.vcs = vcs;
        this.tool = tool;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.VERSION_INFO;
    }

    @Override
    public OperationPlan plan(OperationParams params) {
        return OperationPlan.of(
            Step.of("Reading current version...", ctx -> {
                Optional<String> tag = vcs.getLastTag();
                ctx.put(CURRENT_VERSION_KEY, tag.orElse("none"));
                return tag.orElse("");
            }),
            Step.of("Counting commits since last release...", ctx -> {
                String tag = ctx.previousResult().filter(value -> !value.isEmpty()).orElse(null);
                int count = vcs.getCommitsSince(tag).size();
                ctx.put(COMMIT_COUNT_KEY, count);
                return String.valueOf(count);
            }),
            Step.of("Running semantic-release dry run...", ctx -> {
                ToolResult result = tool.run(true);
                ReleasePreview preview = ReleasePreview.parse(result.stdout() + "\n" + result.stderr());
                String current = ctx.get(CURRENT_VERSION_KEY, String.class).orElse("none");
                int count = ctx.get(COMMIT_COUNT_KEY, Integer.class).orElse(0);
                return summary(current, preview, count);
            })
        );
    }

    static String summary(String current, ReleasePreview preview, int commitCount) {
        return "Current version: " + current + "\n"
            + "Next version: " + preview.nextVersion() + " (" + preview.bump().name().toLowerCase() + ")\n"
            + "Commits since last release: " + commitCount + "\n"
            + "Unreleased changes: " + (commitCount > 0 ? "yes" : "no");
    }
}
