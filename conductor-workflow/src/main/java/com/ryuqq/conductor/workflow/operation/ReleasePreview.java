package com.ryuqq.conductor.workflow.operation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * semantic-release dry run 출력에서 읽어낸 다음 릴리스 정보.
 *
 * @author Conductor Team
 * @since 1.0.0
 * @param nextVersion 다음 버전, "No release needed" 또는 "Unable to determine"
 * @param bump 버전 증가 유형
 */
public record ReleasePreview(String nextVersion, Bump bump) {

    public static final String NO_RELEASE = "No release needed";
    public static final String UNKNOWN_VERSION = "Unable to determine";

    private static final Pattern NEXT_VERSION = Pattern.compile("The next release version is (\\d+\\.\\d+\\.\\d+)");

    /**
     * 버전 증가 유형.
     */
    public enum Bump {
        MAJOR, MINOR, PATCH, NONE, UNKNOWN
    }

    public ReleasePreview {
        if (nextVersion == null || nextVersion.isBlank()) {
            throw new IllegalArgumentException("nextVersion cannot be null or blank");
        }
        if (bump == null) {
            throw new IllegalArgumentException("bump cannot be null");
        }
    }

    /**
     * dry run의 stdout + stderr를 해석합니다.
     *
     * @param output 합쳐진 출력 (null이면 빈 문자열로 취급)
     * @return 해석 결과
     */
    public static ReleasePreview parse(String output) {
        String text = output == null ? "" : output;
        boolean noRelease = text.contains("no release") || text.contains("No release published");

        String nextVersion;
        Matcher matcher = NEXT_VERSION.matcher(text);
        if (matcher.find()) {
            nextVersion = matcher.group(1);
        } else if (noRelease) {
            nextVersion = NO_RELEASE;
        } else {
            nextVersion = UNKNOWN_VERSION;
        }

        Bump bump;
        if (text.contains("BREAKING CHANGE") || text.contains("major")) {
            bump = Bump.MAJOR;
        } else if (text.contains("feat") || text.contains("minor")) {
            bump = Bump.MINOR;
        } else if (text.contains("fix") || text.contains("patch")) {
            bump = Bump.PATCH;
        } else if (noRelease) {
            bump = Bump.NONE;
        } else {
            bump = Bump.UNKNOWN;
        }
        return new ReleasePreview(nextVersion, bump);
    }
}
