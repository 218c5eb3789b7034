package com.ryuqq.conductor.workflow;

import com.ryuqq.conductor.application.catalog.OperationCatalog;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.testkit.fake.RecordingArtifactStore;
import com.ryuqq.conductor.testkit.fake.ScriptedAiClient;
import com.ryuqq.conductor.testkit.fake.ScriptedReleaseToolClient;
import com.ryuqq.conductor.testkit.fake.ScriptedVcsClient;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * WorkflowCatalog 테스트.
 */
class WorkflowCatalogTest {

    @Test
    void create_모든_작업을_등록함() {
        OperationCatalog catalog = WorkflowCatalog.create(new ScriptedVcsClient(), new ScriptedAiClient(),
            new ScriptedReleaseToolClient(), new RecordingArtifactStore(), Clock.systemUTC());

        assertThat(catalog.kinds()).containsExactlyInAnyOrder(OperationKind.values());
    }

    @Test
    void forWorkspace_기본_협력자로_구성함() {
        OperationCatalog catalog = WorkflowCatalog.forWorkspace(Path.of("."), new ScriptedAiClient());

        assertThat(catalog.require(OperationKind.RELEASE_NOTES_GENERATION).kind())
            .isEqualTo(OperationKind.RELEASE_NOTES_GENERATION);
    }
}
