package com.ryuqq.conductor.workflow;

import com.ryuqq.conductor.application.catalog.OperationCatalog;
import com.ryuqq.conductor.core.collaborator.AiClient;
import com.ryuqq.conductor.core.collaborator.ArtifactStore;
import com.ryuqq.conductor.core.collaborator.ReleaseToolClient;
import com.ryuqq.conductor.core.collaborator.VcsClient;
import com.ryuqq.conductor.workflow.operation.AiAnalysisOperation;
import com.ryuqq.conductor.workflow.operation.GitHubSetupOperation;
import com.ryuqq.conductor.workflow.operation.ReleaseNotesOperation;
import com.ryuqq.conductor.workflow.operation.SemanticReleaseOperation;
import com.ryuqq.conductor.workflow.operation.VersionInfoOperation;
import com.ryuqq.conductor.workflow.process.GitCliVcsClient;
import com.ryuqq.conductor.workflow.process.NpxReleaseToolClient;
import com.ryuqq.conductor.workflow.process.ProcessRunner;
import com.ryuqq.conductor.workflow.storage.FileSystemArtifactStore;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * 모든 작업을 등록한 {@link OperationCatalog} 생성.
 *
 * <pre>
 * OperationCatalog catalog = WorkflowCatalog.forWorkspace(Path.of("."), geminiClient);
 * BackgroundDispatcher dispatcher = BackgroundDispatcher.inMemory(catalog, new DispatcherConfig());
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class WorkflowCatalog {

    /**
     * 외부 명령 기본 타임아웃 (semantic-release 실행 포함).
     */
    public static final Duration DEFAULT_PROCESS_TIMEOUT = Duration.ofMinutes(5);

    private WorkflowCatalog() {
    }

    public static OperationCatalog create(
        VcsClient vcs,
        AiClient ai,
        ReleaseToolClient tool,
        ArtifactStore store,
        Clock clock
    ) {
        return OperationCatalog.of(
            new AiAnalysisOperation(vcs, ai),
            new ReleaseNotesOperation(vcs, ai, store, clock),
            new SemanticReleaseOperation(tool),
            new VersionInfoOperation(vcs, tool),
            new GitHubSetupOperation(store)
        );
    }

    /**
     * git / npx / 파일시스템 협력자로 구성합니다. AI 클라이언트만 호출자가 제공합니다.
     *
     * @param workspace 저장소 루트
     * @param ai AI 제공자 클라이언트
     */
    public static OperationCatalog forWorkspace(Path workspace, AiClient ai) {
        ProcessRunner runner = new ProcessRunner(workspace, DEFAULT_PROCESS_TIMEOUT);
        return create(
            new GitCliVcsClient(runner),
            ai,
            new NpxReleaseToolClient(runner),
            new FileSystemArtifactStore(workspace),
            Clock.systemUTC()
        );
    }
}
