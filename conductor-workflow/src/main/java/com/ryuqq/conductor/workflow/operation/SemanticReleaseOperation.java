package com.ryuqq.conductor.workflow.operation;

import com.ryuqq.conductor.application.catalog.OperationFactory;
import com.ryuqq.conductor.core.collaborator.ReleaseToolClient;
import com.ryuqq.conductor.core.collaborator.ToolResult;
import com.ryuqq.conductor.core.error.CollaboratorException;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.plan.OperationPlan;
import com.ryuqq.conductor.core.plan.Step;

/**
 * semantic-release 실행 작업 ({@link OperationKind#SEMANTIC_RELEASE}).
 *
 * <p>{@code params.dryRun=true}면 {@code --dry-run}으로 실행합니다.
 * 0이 아닌 종료 코드는 stderr를 메시지로 하는 {@link CollaboratorException}이 됩니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class SemanticReleaseOperation implements OperationFactory {

    static final String COLLABORATOR = "semantic-release";

    private final ReleaseToolClient tool;

    public SemanticReleaseOperation(ReleaseToolClient tool) {
        if (tool == null) {
            throw new IllegalArgumentException("tool cannot be null");
        }
        this.tool = tool;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.SEMANTIC_RELEASE;
    }

    @Override
    public OperationPlan plan(OperationParams params) {
        boolean dryRun = params.getBoolean(OperationParams.DRY_RUN, false);
        String mode = dryRun ? "dry run" : "release";

        return OperationPlan.of(
            Step.of("Checking semantic-release prerequisites...", ctx -> tool.version()),
            Step.of("Running semantic-release " + mode + "...", ctx -> {
                ToolResult result = tool.run(dryRun);
                if (!result.isSuccess()) {
                    String reason = result.stderr().isBlank()
                        ? "semantic-release " + mode + " exited with code " + result.exitCode()
                        : result.stderr().trim();
                    throw new CollaboratorException(COLLABORATOR, reason);
                }
                String output = result.stdout().trim();
                return output.isEmpty() ? "semantic-release " + mode + " finished" : output;
            })
        );
    }
}
