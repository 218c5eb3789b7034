package com.ryuqq.conductor.core.collaborator;

import com.ryuqq.conductor.core.error.CollaboratorException;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Destination for generated documents and scaffolded project files.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface ArtifactStore {

    /**
     * Writes (or overwrites) a text artifact.
     *
     * @param relativePath path relative to the store root
     * @param content UTF-8 content
     * @return location of the written artifact
     * @throws CollaboratorException if the write failed
     */
    Path write(String relativePath, String content) throws CollaboratorException;

    /**
     * Reads a text artifact if it exists.
     *
     * @param relativePath path relative to the store root
     * @return UTF-8 content, or empty if there is no such artifact
     * @throws CollaboratorException if the artifact exists but could not be read
     */
    Optional<String> read(String relativePath) throws CollaboratorException;
}
