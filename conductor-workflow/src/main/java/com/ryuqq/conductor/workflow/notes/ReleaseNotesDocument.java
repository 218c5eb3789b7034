package com.ryuqq.conductor.workflow.notes;

import com.ryuqq.conductor.core.collaborator.CommitInfo;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 커밋 목록으로 구조화된 릴리스 노트 markdown을 생성합니다.
 *
 * <p>섹션 순서: 일반 정보 → 변경 요약 (feat, fix, perf, refactor, docs, other) →
 * Breaking Changes. 비어 있는 섹션은 생략합니다. 이 문서는 그대로 저장되고
 * AI 다듬기 단계의 입력으로도 쓰입니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class ReleaseNotesDocument {

    private static final Map<String, String> SECTION_TITLES = new LinkedHashMap<>();

    static {
        SECTION_TITLES.put("feat", "New Features");
        SECTION_TITLES.put("fix", "Bug Fixes");
        SECTION_TITLES.put("perf", "Performance Improvements");
        SECTION_TITLES.put("refactor", "Refactoring");
        SECTION_TITLES.put("docs", "Documentation");
        SECTION_TITLES.put(ConventionalCommit.OTHER, "Other Changes");
    }

    private static final DateTimeFormatter COMMIT_DATE =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss xx").withZone(ZoneOffset.UTC);

    private ReleaseNotesDocument() {
    }

    /**
     * @param previousTag 이전 릴리스 태그 (없으면 null)
     * @param commits 포함할 커밋 (최신순)
     * @param date 작성일
     * @return markdown 문서
     */
    public static String render(String previousTag, List<CommitInfo> commits, LocalDate date) {
        if (commits == null) {
            throw new IllegalArgumentException("commits cannot be null");
        }
        if (date == null) {
            throw new IllegalArgumentException("date cannot be null");
        }
        List<ConventionalCommit> parsed = new ArrayList<>();
        for (CommitInfo commit : commits) {
            parsed.add(ConventionalCommit.parse(commit));
        }

        StringBuilder document = new StringBuilder();

        // 1. 일반 정보
        document.append("# Release Notes\n\n");
        document.append("## General Information\n\n");
        document.append("- **Previous release**: ").append(previousTag == null ? "none" : previousTag).append('\n');
        document.append("- **Date**: ").append(date).append('\n');
        document.append("- **Total commits**: ").append(parsed.size()).append("\n\n");

        // 2. 타입별 변경 요약
        document.append("## Summary of Changes\n\n");
        Map<String, List<ConventionalCommit>> byType = groupByType(parsed);
        for (Map.Entry<String, String> section : SECTION_TITLES.entrySet()) {
            List<ConventionalCommit> group = byType.get(section.getKey());
            if (group == null || group.isEmpty()) {
                continue;
            }
            document.append("### ").append(section.getValue()).append(" (").append(group.size()).append(")\n\n");
            for (ConventionalCommit commit : group) {
                appendEntry(document, commit);
                if (!commit.commit().body().isBlank()) {
                    document.append("  - Details: ").append(singleLine(commit.commit().body())).append('\n');
                }
            }
            document.append('\n');
        }

        // 3. Breaking changes
        List<ConventionalCommit> breaking = new ArrayList<>();
        for (ConventionalCommit commit : parsed) {
            if (commit.isBreaking()) {
                breaking.add(commit);
            }
        }
        if (!breaking.isEmpty()) {
            document.append("## Breaking Changes\n\n");
            for (ConventionalCommit commit : breaking) {
                appendEntry(document, commit);
                for (String change : commit.breakingChanges()) {
                    document.append("  - Details: ").append(change).append('\n');
                }
            }
            document.append('\n');
        }

        return document.toString();
    }

    static String sectionOf(String type) {
        return SECTION_TITLES.containsKey(type) ? type : ConventionalCommit.OTHER;
    }

    private static Map<String, List<ConventionalCommit>> groupByType(List<ConventionalCommit> commits) {
        Map<String, List<ConventionalCommit>> groups = new LinkedHashMap<>();
        for (ConventionalCommit commit : commits) {
            groups.computeIfAbsent(sectionOf(commit.type()), key -> new ArrayList<>()).add(commit);
        }
        return groups;
    }

    private static void appendEntry(StringBuilder document, ConventionalCommit commit) {
        CommitInfo info = commit.commit();
        document.append("- **").append(commit.description()).append("** [").append(info.shortHash()).append("] - ")
            .append(info.authorName()).append(" <").append(info.authorEmail()).append("> (")
            .append(COMMIT_DATE.format(info.committedAt())).append(")\n");
    }

    private static String singleLine(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return String.join(" | ", lines);
    }
}
