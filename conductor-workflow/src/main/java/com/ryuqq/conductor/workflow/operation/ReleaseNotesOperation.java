package com.ryuqq.conductor.workflow.operation;

import com.ryuqq.conductor.application.catalog.OperationFactory;
import com.ryuqq.conductor.core.collaborator.AiClient;
import com.ryuqq.conductor.core.collaborator.ArtifactStore;
import com.ryuqq.conductor.core.collaborator.CommitInfo;
import com.ryuqq.conductor.core.collaborator.VcsClient;
import com.ryuqq.conductor.core.error.UserInputException;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.plan.OperationPlan;
import com.ryuqq.conductor.core.plan.Step;
import com.ryuqq.conductor.core.plan.StepCancelledException;
import com.ryuqq.conductor.workflow.notes.ReleaseNotesDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 마지막 릴리스 이후 커밋으로 릴리스 노트를 생성하는 작업
 * ({@link OperationKind#RELEASE_NOTES_GENERATION}).
 *
 * <p><strong>Step:</strong></p>
 * <ol>
 *   <li>마지막 태그 이후 커밋 수집 및 구조화 문서 생성 (커밋이 없으면 UserInputException)</li>
 *   <li>{@code <releaseNotesDir>/release-notes-<date>_STRUCTURED.md} 저장</li>
 *   <li>AI로 다듬어 {@code _AI.md} 저장</li>
 * </ol>
 *
 * <p>AI 단계 실패는 작업 실패가 아닙니다. 구조화 문서 경로와 안내 문구로 완료합니다.
 * 취소는 그대로 전파됩니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class ReleaseNotesOperation implements OperationFactory {

    private static final Logger log = LoggerFactory.getLogger(ReleaseNotesOperation.class);

    static final String NO_COMMITS = "No commits found since the last release";
    static final String DOCUMENT_KEY = "releaseNotes.document";
    static final String STRUCTURED_PATH_KEY = "releaseNotes.structuredPath";

    private final VcsClient vcs;
    private final AiClient ai;
    private final ArtifactStore store;
    private final Clock clock;

    public ReleaseNotesOperation(VcsClient vcs, AiClient ai, ArtifactStore store, Clock clock) {
        if (vcs == null) {
            throw new IllegalArgumentException("vcs cannot be null");
        }
        if (ai == null) {
            throw new IllegalArgumentException("ai cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.vcs = vcs;
        this.ai = ai;
        this.store = store;
        this.clock = clock;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.RELEASE_NOTES_GENERATION;
    }

    @Override
    public OperationPlan plan(OperationParams params) {
        String directory = params.settings().releaseNotesDir();
        String language = params.settings().promptLanguage();
        LocalDate date = LocalDate.now(clock);
        String baseName = directory + "/release-notes-" + date;

        return OperationPlan.of(
            Step.of("Getting commits since last release...", ctx -> {
                String lastTag = vcs.getLastTag().orElse(null);
                List<CommitInfo> commits = vcs.getCommitsSince(lastTag);
                if (commits.isEmpty()) {
                    throw new UserInputException(NO_COMMITS);
                }
                ctx.progress("Found " + commits.size() + " commits since " + (lastTag == null ? "the first commit" : lastTag));
                String document = ReleaseNotesDocument.render(lastTag, commits, date);
                ctx.put(DOCUMENT_KEY, document);
                return document;
            }),
            Step.of("Writing structured release notes...", ctx -> {
                String document = ctx.get(DOCUMENT_KEY, String.class).orElseThrow();
                Path path = store.write(baseName + "_STRUCTURED.md", document);
                ctx.put(STRUCTURED_PATH_KEY, path);
                return path.toString();
            }),
            Step.of("Generating release notes with AI...", ctx -> {
                String document = ctx.get(DOCUMENT_KEY, String.class).orElseThrow();
                Path structured = ctx.get(STRUCTURED_PATH_KEY, Path.class).orElseThrow();
                String polished;
                try {
                    polished = ctx.awaitAsync(executor -> ai.generateText(Prompts.releaseNotes(document, language), executor));
                } catch (StepCancelledException e) {
                    throw e;
                } catch (Exception e) {
                    log.warn("AI release notes failed for {}, keeping structured notes: {}", ctx.operationId(), e.toString());
                    return "Structured release notes saved to " + structured
                        + " (AI generation failed: " + describe(e) + ")";
                }
                Path aiPath = store.write(baseName + "_AI.md", polished);
                return "Release notes saved to " + aiPath + " (structured data: " + structured + ")";
            })
        );
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
