package com.williamcallahan.skillcatalog.domain;

/**
 * Existing public record whose normalized content matches an incoming submission.
 *
 * @param skillId matching record id
 * @param slug matching record slug
 * @param stars matching record stars
 */
public record DuplicateCandidate(String skillId, String slug, int stars) {
}
