package com.ryuqq.conductor.core.model;

/**
 * 백그라운드 Operation 종류 (닫힌 집합).
 *
 * <p>OperationKind는 single-flight 키로 사용됩니다.
 * 같은 종류의 Operation은 동시에 하나만 실행될 수 있으며,
 * 서로 다른 종류는 자유롭게 병렬 실행됩니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public enum OperationKind {

    /**
     * 변경 사항(diff)에 대한 AI 분석.
     */
    AI_ANALYSIS("AI analysis"),

    /**
     * 마지막 태그 이후 커밋으로 릴리스 노트 문서 생성.
     */
    RELEASE_NOTES_GENERATION("Release notes generation"),

    /**
     * semantic-release 실행 (dry-run 포함).
     */
    SEMANTIC_RELEASE("Semantic release"),

    /**
     * 현재/다음 버전 정보 분석.
     */
    VERSION_INFO("Version info"),

    /**
     * semantic-release용 GitHub Actions 설정 파일 생성.
     */
    GITHUB_SETUP("GitHub Actions setup");

    private final String displayName;

    OperationKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * UI 표시용 이름.
     *
     * @return 표시 이름
     */
    public String displayName() {
        return displayName;
    }
}
