package com.ryuqq.conductor.workflow.notes;

import com.ryuqq.conductor.core.collaborator.CommitInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conventional Commits 형식으로 해석한 커밋.
 *
 * <p>제목이 {@code type(scope)!: description} 형식이 아니면 type은 {@link #OTHER}가 되고
 * 제목 전체가 description이 됩니다.</p>
 *
 * <p><strong>Breaking change 인식:</strong></p>
 * <ul>
 *   <li>본문의 {@code BREAKING CHANGE:} / {@code BREAKING-CHANGE:} 줄 (빈 줄 또는 ':'를 포함한 줄 전까지 이어붙임)</li>
 *   <li>제목의 {@code !} 표기 (본문에 설명이 없으면 description 사용)</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 * @param type 커밋 타입 (feat, fix, ... 또는 other)
 * @param scope 범위 (없으면 빈 문자열)
 * @param description 설명
 * @param breakingChanges breaking change 설명 목록
 * @param commit 원본 커밋
 */
public record ConventionalCommit(
    String type,
    String scope,
    String description,
    List<String> breakingChanges,
    CommitInfo commit
) {

    public static final String OTHER = "other";

    private static final Pattern HEADER = Pattern.compile(
        "^(feat|fix|docs|style|refactor|perf|test|chore|revert|build|ci)(\\(([^)]+)\\))?(!)?:\\s*(.+)$");

    private static final String[] BREAKING_PREFIXES = {"BREAKING CHANGE:", "BREAKING-CHANGE:"};

    public ConventionalCommit {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (commit == null) {
            throw new IllegalArgumentException("commit cannot be null");
        }
        scope = scope == null ? "" : scope;
        description = description == null ? "" : description;
        breakingChanges = breakingChanges == null ? List.of() : List.copyOf(breakingChanges);
    }

    /**
     * 커밋 제목과 본문을 해석합니다.
     *
     * @param commit 원본 커밋 (null 불가)
     * @return 해석 결과
     */
    public static ConventionalCommit parse(CommitInfo commit) {
        if (commit == null) {
            throw new IllegalArgumentException("commit cannot be null");
        }
        String subject = commit.subject().trim();
        Matcher matcher = HEADER.matcher(subject);
        List<String> breaking = breakingChangesOf(commit.body());

        if (!matcher.matches()) {
            return new ConventionalCommit(OTHER, "", subject, breaking, commit);
        }
        String description = matcher.group(5).trim();
        if (matcher.group(4) != null && breaking.isEmpty()) {
            breaking = List.of(description);
        }
        return new ConventionalCommit(matcher.group(1), matcher.group(3), description, breaking, commit);
    }

    public boolean isBreaking() {
        return !breakingChanges.isEmpty();
    }

    static List<String> breakingChangesOf(String body) {
        List<String> changes = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return changes;
        }
        String[] lines = body.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String prefix = breakingPrefixOf(lines[i]);
            if (prefix == null) {
                continue;
            }
            StringBuilder change = new StringBuilder(lines[i].substring(prefix.length()).trim());
            for (int j = i + 1; j < lines.length; j++) {
                String next = lines[j].trim();
                if (next.isEmpty() || next.contains(":")) {
                    break;
                }
                change.append(' ').append(next);
            }
            if (change.length() > 0) {
                changes.add(change.toString());
            }
        }
        return changes;
    }

    private static String breakingPrefixOf(String line) {
        for (String prefix : BREAKING_PREFIXES) {
            if (line.startsWith(prefix)) {
                return prefix;
            }
        }
        return null;
    }
}
