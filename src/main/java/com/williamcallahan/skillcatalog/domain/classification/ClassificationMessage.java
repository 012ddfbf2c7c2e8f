package com.williamcallahan.skillcatalog.domain.classification;

import java.util.List;
import java.util.Objects;

/**
 * Classification queue message produced by ingestion and by the reclassification detector.
 *
 * @param skillId record to classify
 * @param repoOwner repository owner, used by the admission policy
 * @param repoName repository name
 * @param skillMdPath blob key of the cached marker file
 * @param frontmatterCategories categories declared in front-matter
 * @param tags declared tags
 * @param stars star count at enqueue time, null to read it from the record
 * @param reclassification forces the AI path and skips the direct match
 */
public record ClassificationMessage(
        String skillId,
        String repoOwner,
        String repoName,
        String skillMdPath,
        List<String> frontmatterCategories,
        List<String> tags,
        Integer stars,
        boolean reclassification) {

    public ClassificationMessage {
        Objects.requireNonNull(skillId, "skillId");
        Objects.requireNonNull(repoOwner, "repoOwner");
        Objects.requireNonNull(repoName, "repoName");
        Objects.requireNonNull(skillMdPath, "skillMdPath");
        frontmatterCategories = frontmatterCategories == null ? List.of() : List.copyOf(frontmatterCategories);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
