package com.ryuqq.conductor.core.config;

import java.nio.file.Path;

/**
 * Worker가 사용하는 설정 스냅샷 (불변 record).
 *
 * <p>설정 파일 파싱은 이 모듈의 책임이 아니며, 호출자가 파싱한 결과를
 * 이 record로 변환하여 {@code OperationParams}에 담아 전달합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workspaceDir: 저장소 루트 (기본: 현재 디렉터리)</li>
 *   <li>releaseNotesDir: 릴리스 노트 출력 디렉터리, workspaceDir 기준 상대 경로 (기본 release-notes)</li>
 *   <li>aiModel: AI 모델 이름 (기본 gemini-1.5-flash)</li>
 *   <li>promptLanguage: AI 응답 언어 (기본 English)</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 * @param workspaceDir 저장소 루트 (null 불가)
 * @param releaseNotesDir 릴리스 노트 출력 디렉터리 (null/blank 불가)
 * @param aiModel AI 모델 이름 (null/blank 불가)
 * @param promptLanguage AI 응답 언어 (null/blank 불가)
 */
public record ConductorSettings(
    Path workspaceDir,
    String releaseNotesDir,
    String aiModel,
    String promptLanguage
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workspaceDir=".", releaseNotesDir="release-notes",
     * aiModel="gemini-1.5-flash", promptLanguage="English"</p>
     */
    public ConductorSettings() {
        this(Path.of("."), "release-notes", "gemini-1.5-flash", "English");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConductorSettings {
        if (workspaceDir == null) {
            throw new IllegalArgumentException("workspaceDir cannot be null");
        }
        if (releaseNotesDir == null || releaseNotesDir.isBlank()) {
            throw new IllegalArgumentException("releaseNotesDir cannot be null or blank");
        }
        if (aiModel == null || aiModel.isBlank()) {
            throw new IllegalArgumentException("aiModel cannot be null or blank");
        }
        if (promptLanguage == null || promptLanguage.isBlank()) {
            throw new IllegalArgumentException("promptLanguage cannot be null or blank");
        }
    }

    /**
     * workspaceDir만 변경한 새 인스턴스 생성.
     */
    public ConductorSettings withWorkspaceDir(Path workspaceDir) {
        return new ConductorSettings(workspaceDir, releaseNotesDir, aiModel, promptLanguage);
    }

    /**
     * releaseNotesDir만 변경한 새 인스턴스 생성.
     */
    public ConductorSettings withReleaseNotesDir(String releaseNotesDir) {
        return new ConductorSettings(workspaceDir, releaseNotesDir, aiModel, promptLanguage);
    }

    /**
     * aiModel만 변경한 새 인스턴스 생성.
     */
    public ConductorSettings withAiModel(String aiModel) {
        return new ConductorSettings(workspaceDir, releaseNotesDir, aiModel, promptLanguage);
    }

    /**
     * promptLanguage만 변경한 새 인스턴스 생성.
     */
    public ConductorSettings withPromptLanguage(String promptLanguage) {
        return new ConductorSettings(workspaceDir, releaseNotesDir, aiModel, promptLanguage);
    }
}
