package com.williamcallahan.skillcatalog.domain;

/**
 * One row of a published listing snapshot.
 */
public record ListingEntry(
        String id,
        String slug,
        String name,
        String description,
        String repoOwner,
        String repoName,
        String skillPath,
        int stars,
        int forks,
        double trendingScore,
        long updatedAt) {
}
