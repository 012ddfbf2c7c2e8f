package com.williamcallahan.skillcatalog.service.github;

import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.RepositoryMetadata;
import com.williamcallahan.skillcatalog.domain.ingestion.RepositoryFile;
import com.williamcallahan.skillcatalog.domain.ingestion.RepositoryTreeEntry;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to repository metadata and content on the hosting provider.
 *
 * <p>Missing repositories, files and commits are reported as empty results. Other failures
 * raise {@link GitHubApiException}.</p>
 */
public interface RepositoryMetadataClient {

    Optional<RepositoryMetadata> fetchRepository(String owner, String name);

    /**
     * Fetches one file with inline content.
     *
     * @param path path relative to the repository root
     * @return the file, or empty when it does not exist or the path is a directory
     */
    Optional<RepositoryFile> fetchFile(String owner, String name, String path);

    /**
     * Returns the sha of the latest commit touching a path; an empty path means the whole repository.
     */
    Optional<String> fetchLatestCommitSha(String owner, String name, String path);

    /**
     * Lists all blobs reachable from a ref.
     *
     * @param ref branch name, tag or commit sha
     */
    List<RepositoryTreeEntry> fetchTree(String owner, String name, String ref);

    /**
     * Fetches metadata for many repositories using batched queries.
     *
     * @return metadata keyed by {@link RepositoryIdentity#repoKey()}; repositories that no longer
     *     exist are absent
     */
    Map<String, RepositoryMetadata> fetchRepositories(List<RepositoryIdentity> identities);
}
