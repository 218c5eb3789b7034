package com.ryuqq.conductor.workflow.operation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReleasePreview 해석 테스트.
 */
class ReleasePreviewTest {

    @Test
    void 다음_버전과_증가_유형을_읽음() {
        ReleasePreview preview = ReleasePreview.parse(
            "[semantic-release] › ℹ  Analysis of 3 commits complete: major release\n"
                + "[semantic-release] › ℹ  The next release version is 2.0.0\n");

        assertThat(preview).isEqualTo(new ReleasePreview("2.0.0", ReleasePreview.Bump.MAJOR));
    }

    @Test
    void patch_릴리스() {
        assertThat(ReleasePreview.parse("patch release\nThe next release version is 1.0.1").bump())
            .isEqualTo(ReleasePreview.Bump.PATCH);
    }

    @Test
    void 릴리스가_필요_없는_경우() {
        ReleasePreview preview = ReleasePreview.parse("No release published.");

        assertThat(preview.nextVersion()).isEqualTo(ReleasePreview.NO_RELEASE);
        assertThat(preview.bump()).isEqualTo(ReleasePreview.Bump.NONE);
    }

    @Test
    void 알_수_없는_출력() {
        ReleasePreview preview = ReleasePreview.parse(null);

        assertThat(preview.nextVersion()).isEqualTo(ReleasePreview.UNKNOWN_VERSION);
        assertThat(preview.bump()).isEqualTo(ReleasePreview.Bump.UNKNOWN);
    }

    @Test
    void 생성자_검증() {
        assertThatThrownBy(() -> new ReleasePreview(" ", ReleasePreview.Bump.NONE))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReleasePreview("1.0.0", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
