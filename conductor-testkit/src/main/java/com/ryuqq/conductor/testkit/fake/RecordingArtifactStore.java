package com.ryuqq.conductor.testkit.fake;

import com.ryuqq.conductor.core.collaborator.ArtifactStore;
import com.ryuqq.conductor.core.error.CollaboratorException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ArtifactStore} that keeps written artifacts in memory.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class RecordingArtifactStore implements ArtifactStore {

    private final Path root;
    private final Map<String, String> artifacts = new LinkedHashMap<>();
    private CollaboratorException failure;

    public RecordingArtifactStore() {
        this(Path.of("workspace"));
    }

    public RecordingArtifactStore(Path root) {
        this.root = root;
    }

    public synchronized RecordingArtifactStore failingWith(CollaboratorException failure) {
        this.failure = failure;
        return this;
    }

    @Override
    public synchronized Path write(String relativePath, String content) throws CollaboratorException {
        if (failure != null) {
            throw failure;
        }
        artifacts.put(relativePath, content);
        return root.resolve(relativePath);
    }

    @Override
    public synchronized Optional<String> read(String relativePath) throws CollaboratorException {
        if (failure != null) {
            throw failure;
        }
        return Optional.ofNullable(artifacts.get(relativePath));
    }

    /**
     * Seeds an artifact as if it had been written before.
     */
    public synchronized RecordingArtifactStore withArtifact(String relativePath, String content) {
        artifacts.put(relativePath, content);
        return this;
    }

    public synchronized Map<String, String> artifacts() {
        return new LinkedHashMap<>(artifacts);
    }

    /**
     * @return content of the first artifact whose path ends with the suffix
     */
    public synchronized Optional<String> findBySuffix(String suffix) {
        return artifacts.entrySet().stream()
            .filter(entry -> entry.getKey().endsWith(suffix))
            .map(Map.Entry::getValue)
            .findFirst();
    }
}
