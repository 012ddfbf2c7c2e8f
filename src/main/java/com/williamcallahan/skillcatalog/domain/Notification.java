package com.williamcallahan.skillcatalog.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * User notification, stored at most once per (userId, skillId, type).
 *
 * @param id notification id
 * @param userId recipient
 * @param skillId record the notification is about
 * @param type notification type, e.g. {@code skill_curated}
 * @param title short title
 * @param message body text
 * @param createdAt creation time
 */
public record Notification(
        String id, String userId, String skillId, String type, String title, String message, Instant createdAt) {

    public Notification {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(skillId, "skillId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
