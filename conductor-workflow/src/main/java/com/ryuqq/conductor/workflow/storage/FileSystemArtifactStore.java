package com.ryuqq.conductor.workflow.storage;

import com.ryuqq.conductor.core.collaborator.ArtifactStore;
import com.ryuqq.conductor.core.error.CollaboratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@link ArtifactStore} writing UTF-8 files under a root directory.
 *
 * <p>Missing parent directories are created. Paths that resolve outside the root are rejected.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    static final String COLLABORATOR = "filesystem";

    private final Path root;

    public FileSystemArtifactStore(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Path write(String relativePath, String content) throws CollaboratorException {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        Path target = resolve(relativePath, "write");
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CollaboratorException(COLLABORATOR, "Failed to write " + target + ": " + e.getMessage(), e);
        }
        log.debug("Wrote {} ({} chars)", target, content.length());
        return target;
    }

    @Override
    public Optional<String> read(String relativePath) throws CollaboratorException {
        Path target = resolve(relativePath, "read");
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CollaboratorException(COLLABORATOR, "Failed to read " + target + ": " + e.getMessage(), e);
        }
    }

    public Path root() {
        return root;
    }

    private Path resolve(String relativePath, String action) throws CollaboratorException {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath cannot be null or blank");
        }
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new CollaboratorException(COLLABORATOR,
                "Refusing to " + action + " outside " + root + ": " + relativePath);
        }
        return target;
    }
}
