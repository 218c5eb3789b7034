package com.ryuqq.conductor.workflow.storage;

import com.ryuqq.conductor.core.error.CollaboratorException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FileSystemArtifactStore 테스트.
 */
class FileSystemArtifactStoreTest {

    @TempDir
    Path root;

    @Test
    void write_하위_디렉터리를_만들고_UTF8로_저장함() throws Exception {
        // given
        FileSystemArtifactStore store = new FileSystemArtifactStore(root);

        // when
        Path written = store.write("release-notes/release-notes-2024-06-01_AI.md", "# Notas de versión ✓");

        // then
        assertThat(written).isEqualTo(root.toAbsolutePath().normalize()
            .resolve("release-notes/release-notes-2024-06-01_AI.md"));
        assertThat(Files.readString(written, StandardCharsets.UTF_8)).isEqualTo("# Notas de versión ✓");
    }

    @Test
    void write_같은_경로는_덮어씀() throws Exception {
        // given
        FileSystemArtifactStore store = new FileSystemArtifactStore(root);
        store.write("notes.md", "first");

        // when
        Path written = store.write("notes.md", "second");

        // then
        assertThat(Files.readString(written)).isEqualTo("second");
    }

    @Test
    void write_루트_밖으로_나가는_경로는_거부됨() {
        FileSystemArtifactStore store = new FileSystemArtifactStore(root.resolve("workspace"));

        assertThatThrownBy(() -> store.write("../escape.md", "x"))
            .isInstanceOf(CollaboratorException.class)
            .hasMessageContaining("Refusing to write outside");
    }

    @Test
    void write_디렉터리_자리에_파일이_있으면_CollaboratorException() throws Exception {
        // given
        Files.writeString(root.resolve("blocked"), "file");
        FileSystemArtifactStore store = new FileSystemArtifactStore(root);

        // when & then
        assertThatThrownBy(() -> store.write("blocked/notes.md", "x"))
            .isInstanceOf(CollaboratorException.class)
            .hasMessageStartingWith("Failed to write");
    }

    @Test
    void read_없는_파일은_빈_값() throws Exception {
        FileSystemArtifactStore store = new FileSystemArtifactStore(root);

        assertThat(store.read(".gitignore")).isEmpty();
    }

    @Test
    void read_기록된_내용을_반환함() throws Exception {
        // given
        FileSystemArtifactStore store = new FileSystemArtifactStore(root);
        store.write(".github/workflows/release.yml", "name: Release\n");

        // when & then
        assertThat(store.read(".github/workflows/release.yml")).contains("name: Release\n");
    }

    @Test
    void read_루트_밖으로_나가는_경로는_거부됨() {
        FileSystemArtifactStore store = new FileSystemArtifactStore(root.resolve("workspace"));

        assertThatThrownBy(() -> store.read("../secrets.txt"))
            .isInstanceOf(CollaboratorException.class)
            .hasMessageContaining("Refusing to read outside");
    }
}
