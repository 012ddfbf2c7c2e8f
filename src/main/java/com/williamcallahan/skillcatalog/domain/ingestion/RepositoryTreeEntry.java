package com.williamcallahan.skillcatalog.domain.ingestion;

import java.util.Objects;

/**
 * One blob entry from a recursive git tree listing.
 *
 * @param path path relative to the repository root
 * @param size size in bytes
 * @param sha git blob sha
 */
public record RepositoryTreeEntry(String path, long size, String sha) {
    public RepositoryTreeEntry {
        Objects.requireNonNull(path, "path");
    }
}
