package com.williamcallahan.skillcatalog.domain;

import java.util.Objects;

/**
 * One content hash of a catalog record, unique per (skillId, hashType).
 *
 * @param skillId owning record id
 * @param hashType raw or normalized variant
 * @param hashValue lower-case hex SHA-256
 */
public record ContentFingerprint(String skillId, HashType hashType, String hashValue) {
    public ContentFingerprint {
        Objects.requireNonNull(skillId, "skillId");
        Objects.requireNonNull(hashType, "hashType");
        if (hashValue == null || hashValue.isBlank()) {
            throw new IllegalArgumentException("hashValue must not be blank");
        }
    }
}
