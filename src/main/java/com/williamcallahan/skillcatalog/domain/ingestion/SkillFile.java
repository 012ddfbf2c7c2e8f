package com.williamcallahan.skillcatalog.domain.ingestion;

import java.util.Objects;

/**
 * A file collected from a skill's directory.
 *
 * @param relativePath path relative to the skill directory
 * @param size size in bytes
 * @param text cached text content, null for binary or skipped files
 */
public record SkillFile(String relativePath, long size, String text) {
    public SkillFile {
        Objects.requireNonNull(relativePath, "relativePath");
    }

    public boolean isText() {
        return text != null;
    }
}
