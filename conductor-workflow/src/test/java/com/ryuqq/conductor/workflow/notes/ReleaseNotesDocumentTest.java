package com.ryuqq.conductor.workflow.notes;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.ryuqq.conductor.workflow.notes.ConventionalCommitTest.commit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReleaseNotesDocument 렌더링 테스트.
 */
class ReleaseNotesDocumentTest {

    private final LocalDate date = LocalDate.of(2024, 6, 1);

    @Test
    void 타입별_섹션을_고정된_순서로_렌더링함() {
        String document = ReleaseNotesDocument.render("v1.0.0", List.of(
            commit("chore: bump deps", ""),
            commit("fix(ui): align footer", "Footer overlapped\n  the status bar"),
            commit("feat: export csv", ""),
            commit("perf: cache tags", "")
        ), date);

        assertThat(document).startsWith("# Release Notes\n\n## General Information\n\n");
        assertThat(document).contains("- **Total commits**: 4\n");
        assertThat(document.indexOf("### New Features (1)"))
            .isLessThan(document.indexOf("### Bug Fixes (1)"));
        assertThat(document.indexOf("### Bug Fixes (1)"))
            .isLessThan(document.indexOf("### Performance Improvements (1)"));
        assertThat(document.indexOf("### Performance Improvements (1)"))
            .isLessThan(document.indexOf("### Other Changes (1)"));
        assertThat(document).doesNotContain("### Documentation");
        assertThat(document).contains(
            "- **align footer** [0123456] - Dev <dev@example.com> (2024-06-01 12:00:00 +0000)\n"
                + "  - Details: Footer overlapped | the status bar\n");
        assertThat(document).doesNotContain("## Breaking Changes");
    }

    @Test
    void breaking_change가_있으면_별도_섹션을_추가함() {
        String document = ReleaseNotesDocument.render(null, List.of(
            commit("feat!: new config format", "")
        ), date);

        assertThat(document).contains("- **Previous release**: none");
        assertThat(document).contains("## Breaking Changes\n\n- **new config format** [0123456]");
        assertThat(document).contains("  - Details: new config format\n");
    }

    @Test
    void 알려지지_않은_타입은_other로_분류됨() {
        assertThat(ReleaseNotesDocument.sectionOf("style")).isEqualTo(ConventionalCommit.OTHER);
        assertThat(ReleaseNotesDocument.sectionOf("docs")).isEqualTo("docs");
    }

    @Test
    void null_입력은_거부됨() {
        assertThatThrownBy(() -> ReleaseNotesDocument.render("v1", null, date))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("commits cannot be null");
    }
}
