package com.williamcallahan.skillcatalog.domain.ingestion;

import java.util.Objects;

/**
 * A single file fetched from a repository through the contents API.
 *
 * @param path path relative to the repository root
 * @param sha git blob sha
 * @param size size in bytes
 * @param text decoded UTF-8 content, null when the provider returned no inline content
 */
public record RepositoryFile(String path, String sha, long size, String text) {
    public RepositoryFile {
        Objects.requireNonNull(path, "path");
    }

    public boolean hasText() {
        return text != null;
    }
}
