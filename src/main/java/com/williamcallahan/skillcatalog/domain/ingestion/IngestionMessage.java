package com.williamcallahan.skillcatalog.domain.ingestion;

import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import java.util.Objects;

/**
 * Ingestion queue message produced by the discovery feed and by user submissions.
 *
 * @param repoOwner repository owner
 * @param repoName repository name
 * @param skillPath optional subpath of the skill inside the repository
 * @param submittedBy submitting user id, null for discovery events
 * @param forceReindex re-fetch content even when the content commit is unchanged
 */
public record IngestionMessage(
        String repoOwner, String repoName, String skillPath, String submittedBy, boolean forceReindex) {

    public IngestionMessage {
        Objects.requireNonNull(repoOwner, "repoOwner");
        Objects.requireNonNull(repoName, "repoName");
    }

    /**
     * Creates a discovery message for a skill.
     */
    public static IngestionMessage discovered(String repoOwner, String repoName, String skillPath) {
        return new IngestionMessage(repoOwner, repoName, skillPath, null, false);
    }

    /**
     * Returns the normalized repository identity targeted by this message.
     */
    public RepositoryIdentity identity() {
        return RepositoryIdentity.of(repoOwner, repoName, skillPath);
    }

    /**
     * Returns true when a user explicitly submitted this repository.
     */
    public boolean isUserSubmission() {
        return submittedBy != null && !submittedBy.isBlank();
    }
}
