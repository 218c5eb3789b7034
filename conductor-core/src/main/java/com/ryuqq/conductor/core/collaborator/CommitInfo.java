package com.ryuqq.conductor.core.collaborator;

import java.time.Instant;

/**
 * One commit as read from version control.
 *
 * @param hash full commit hash
 * @param authorName author name
 * @param authorEmail author email
 * @param committedAt commit time
 * @param subject first line of the message
 * @param body rest of the message, may be empty
 * @author Conductor Team
 * @since 1.0.0
 */
public record CommitInfo(
    String hash,
    String authorName,
    String authorEmail,
    Instant committedAt,
    String subject,
    String body
) {

    public CommitInfo {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("hash cannot be null or blank");
        }
        if (committedAt == null) {
            throw new IllegalArgumentException("committedAt cannot be null");
        }
        if (subject == null) {
            throw new IllegalArgumentException("subject cannot be null");
        }
        authorName = authorName == null ? "" : authorName;
        authorEmail = authorEmail == null ? "" : authorEmail;
        body = body == null ? "" : body;
    }

    public String shortHash() {
        return hash.length() <= 7 ? hash : hash.substring(0, 7);
    }
}
