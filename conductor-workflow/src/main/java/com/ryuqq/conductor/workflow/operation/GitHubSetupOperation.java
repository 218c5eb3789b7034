package com.ryuqq.conductor.workflow.operation;

import com.ryuqq.conductor.application.catalog.OperationFactory;
import com.ryuqq.conductor.core.collaborator.ArtifactStore;
import com.ryuqq.conductor.core.error.CollaboratorException;
import com.ryuqq.conductor.core.model.OperationKind;
import com.ryuqq.conductor.core.model.OperationParams;
import com.ryuqq.conductor.core.plan.OperationPlan;
import com.ryuqq.conductor.core.plan.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * semantic-release용 GitHub Actions 설정 작업 ({@link OperationKind#GITHUB_SETUP}).
 *
 * <p>저장소 루트에 다음 파일을 만듭니다. 이미 있는 파일은 수정하지 않습니다.</p>
 * <ul>
 *   <li>package.json, .releaserc.json, .github/workflows/release.yml</li>
 *   <li>package-lock.json (package.json이 있을 때만)</li>
 *   <li>.gitignore (이미 있으면 빠진 Node.js 규칙만 추가)</li>
 * </ul>
 *
 * <p>파일 하나의 실패는 요약에 기록하고 다음 파일로 넘어갑니다.
 * 어떤 파일도 생성/확인하지 못했을 때만 작업이 실패합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class GitHubSetupOperation implements OperationFactory {

    private static final Logger log = LoggerFactory.getLogger(GitHubSetupOperation.class);

    static final String COLLABORATOR = "filesystem";

    static final String PACKAGE_JSON = "package.json";
    static final String RELEASERC = ".releaserc.json";
    static final String WORKFLOW = ".github/workflows/release.yml";
    static final String PACKAGE_LOCK = "package-lock.json";
    static final String GITIGNORE = ".gitignore";

    static final List<String> REQUIRED_IGNORE_RULES = List.of("node_modules/", ".env");
    static final String IGNORE_RULES_MARKER = "# Added by semantic-release setup";

    private final ArtifactStore store;

    public GitHubSetupOperation(ArtifactStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    @Override
    public OperationKind kind() {
        return OperationKind.GITHUB_SETUP;
    }

    @Override
    public OperationPlan plan(OperationParams params) {
        SetupReport report = new SetupReport();
        return OperationPlan.of(
            Step.of("Configuring package.json...", ctx -> scaffold(report, PACKAGE_JSON, "package.json")),
            Step.of("Configuring .releaserc.json...", ctx -> scaffold(report, RELEASERC, "releaserc.json")),
            Step.of("Configuring GitHub Actions workflow...", ctx -> scaffold(report, WORKFLOW, "release.yml")),
            Step.of("Configuring package-lock.json...", ctx -> packageLock(report)),
            Step.of("Configuring .gitignore for Node.js...", ctx -> gitignore(report)),
            Step.of("Summarizing GitHub Actions setup...", ctx -> report.summary())
        );
    }

    private String scaffold(SetupReport report, String path, String template) {
        try {
            if (store.read(path).isPresent()) {
                return report.record(path, Outcome.SKIPPED);
            }
            store.write(path, template(template));
            return report.record(path, Outcome.CREATED);
        } catch (CollaboratorException e) {
            return report.fail(path, e.getMessage());
        }
    }

    private String packageLock(SetupReport report) {
        try {
            if (store.read(PACKAGE_LOCK).isPresent()) {
                return report.record(PACKAGE_LOCK, Outcome.SKIPPED);
            }
            if (store.read(PACKAGE_JSON).isEmpty()) {
                return report.fail(PACKAGE_LOCK, PACKAGE_JSON + " is missing");
            }
            store.write(PACKAGE_LOCK, template("package-lock.json"));
            return report.record(PACKAGE_LOCK, Outcome.CREATED);
        } catch (CollaboratorException e) {
            return report.fail(PACKAGE_LOCK, e.getMessage());
        }
    }

    private String gitignore(SetupReport report) {
        try {
            Optional<String> existing = store.read(GITIGNORE);
            if (existing.isEmpty()) {
                store.write(GITIGNORE, template("gitignore.txt"));
                return report.record(GITIGNORE, Outcome.CREATED);
            }
            List<String> missing = missingIgnoreRules(existing.get());
            if (missing.isEmpty()) {
                return report.record(GITIGNORE, Outcome.SKIPPED);
            }
            store.write(GITIGNORE, appendIgnoreRules(existing.get(), missing));
            return report.record(GITIGNORE, Outcome.UPDATED);
        } catch (CollaboratorException e) {
            return report.fail(GITIGNORE, e.getMessage());
        }
    }

    static List<String> missingIgnoreRules(String content) {
        List<String> present = content.lines().map(String::trim).toList();
        List<String> missing = new ArrayList<>();
        for (String rule : REQUIRED_IGNORE_RULES) {
            if (!present.contains(rule)) {
                missing.add(rule);
            }
        }
        return missing;
    }

    static String appendIgnoreRules(String content, List<String> rules) {
        StringBuilder updated = new StringBuilder(content);
        if (!content.isEmpty() && !content.endsWith("\n")) {
            updated.append('\n');
        }
        updated.append('\n').append(IGNORE_RULES_MARKER).append('\n');
        for (String rule : rules) {
            updated.append(rule).append('\n');
        }
        return updated.toString();
    }

    static String template(String name) {
        try (InputStream in = GitHubSetupOperation.class.getResourceAsStream("scaffold/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing scaffold template: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    enum Outcome {
        CREATED("Created"),
        UPDATED("Updated"),
        SKIPPED("Already present (not modified)");

        private final String heading;

        Outcome(String heading) {
            this.heading = heading;
        }
    }

    /**
     * 파일별 결과. 한 작업 실행의 Step들은 같은 워커 스레드에서 순서대로 실행됩니다.
     */
    static final class SetupReport {

        private final Map<String, Outcome> outcomes = new LinkedHashMap<>();
        private final Map<String, String> failures = new LinkedHashMap<>();

        String record(String path, Outcome outcome) {
            outcomes.put(path, outcome);
            return path + ": " + outcome.name().toLowerCase();
        }

        String fail(String path, String reason) {
            log.warn("GitHub Actions setup could not configure {}: {}", path, reason);
            failures.put(path, reason);
            return path + ": failed";
        }

        String summary() throws CollaboratorException {
            if (outcomes.isEmpty()) {
                Map.Entry<String, String> first = failures.entrySet().iterator().next();
                throw new CollaboratorException(COLLABORATOR,
                    "GitHub Actions setup failed: " + first.getKey() + ": " + first.getValue());
            }

            StringBuilder text = new StringBuilder("GitHub Actions setup for semantic-release\n");
            for (Outcome outcome : Outcome.values()) {
                List<String> paths = new ArrayList<>();
                outcomes.forEach((path, recorded) -> {
                    if (recorded == outcome) {
                        paths.add(path);
                    }
                });
                if (!paths.isEmpty()) {
                    text.append('\n').append(outcome.heading).append(":\n");
                    paths.forEach(path -> text.append("  - ").append(path).append('\n'));
                }
            }
            if (!failures.isEmpty()) {
                text.append("\nFailed:\n");
                failures.forEach((path, reason) ->
                    text.append("  - ").append(path).append(": ").append(reason).append('\n'));
            }
            text.append("\nNext steps:\n")
                .append("1. Add a GITHUB_TOKEN secret under Settings > Secrets and variables > Actions.\n")
                .append("2. Run npm install to pin exact dependency versions in package-lock.json.\n")
                .append("3. Use conventional commits: feat (minor), fix (patch), feat! (major).\n")
                .append("4. Push to main to run the first release.");
            return text.toString();
        }
    }
}
