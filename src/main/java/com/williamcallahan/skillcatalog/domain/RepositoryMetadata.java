package com.williamcallahan.skillcatalog.domain;

import java.time.Instant;
import java.util.List;

/**
 * Popularity and activity signals reported by the metadata provider for one repository.
 *
 * @param stars stargazer count
 * @param forks fork count
 * @param fork whether the repository is itself a fork
 * @param pushedAt last push time, or null when unknown
 * @param description repository description, may be null
 * @param topics repository topics, lower-case
 * @param defaultBranch default branch name, or null when the provider did not report it
 */
public record RepositoryMetadata(
        int stars,
        int forks,
        boolean fork,
        Instant pushedAt,
        String description,
        List<String> topics,
        String defaultBranch) {

    public RepositoryMetadata {
        if (stars < 0 || forks < 0) {
            throw new IllegalArgumentException("Counters must not be negative");
        }
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
