package com.williamcallahan.skillcatalog.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The catalog record for one indexed skill.
 *
 * <p>Exactly one record exists per {@link RepositoryIdentity}. The slug is assigned on creation
 * and never changes afterwards. Timestamps that are unknown are null; counters default to zero.</p>
 *
 * @param id stable record identifier
 * @param slug unique URL slug
 * @param identity repository owner, name and subpath
 * @param name display name
 * @param description display description, may be null
 * @param stars stargazer count
 * @param forks fork count
 * @param starSnapshots bounded, time-ordered star history
 * @param trendingScore composite popularity score
 * @param lastCommitAt last push observed on the repository, may be null
 * @param contentHash hash over all cached text files, may be null
 * @param contentCommitSha commit that last touched the skill's files, may be null
 * @param tier refresh tier
 * @param lastAccessedAt last detail-page access, may be null
 * @param accessCount7d rolling seven-day access counter
 * @param accessCount30d rolling thirty-day access counter
 * @param downloadCount7d rolling seven-day download counter
 * @param downloadCount30d rolling thirty-day download counter
 * @param nextUpdateAt next scheduled re-evaluation, null when not proactively scheduled
 * @param classificationMethod method behind the current categories, null when unclassified
 * @param visibility public, private or unlisted
 * @param ownerUserId submitting user for private submissions, may be null
 * @param createdAt creation time
 * @param updatedAt last mutation time
 * @param indexedAt last time content was (re)indexed
 */
public record SkillRecord(
        String id,
        String slug,
        RepositoryIdentity identity,
        String name,
        String description,
        int stars,
        int forks,
        List<StarSnapshot> starSnapshots,
        double trendingScore,
        Instant lastCommitAt,
        String contentHash,
        String contentCommitSha,
        SkillTier tier,
        Instant lastAccessedAt,
        int accessCount7d,
        int accessCount30d,
        int downloadCount7d,
        int downloadCount30d,
        Instant nextUpdateAt,
        ClassificationMethod classificationMethod,
        Visibility visibility,
        String ownerUserId,
        Instant createdAt,
        Instant updatedAt,
        Instant indexedAt) {

    public SkillRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(visibility, "visibility");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        Objects.requireNonNull(indexedAt, "indexedAt");
        starSnapshots = starSnapshots == null ? List.of() : List.copyOf(starSnapshots);
    }

    public boolean isArchived() {
        return tier == SkillTier.ARCHIVED;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this record's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .slug(slug)
                .identity(identity)
                .name(name)
                .description(description)
                .stars(stars)
                .forks(forks)
                .starSnapshots(starSnapshots)
                .trendingScore(trendingScore)
                .lastCommitAt(lastCommitAt)
                .contentHash(contentHash)
                .contentCommitSha(contentCommitSha)
                .tier(tier)
                .lastAccessedAt(lastAccessedAt)
                .accessCount7d(accessCount7d)
                .accessCount30d(accessCount30d)
                .downloadCount7d(downloadCount7d)
                .downloadCount30d(downloadCount30d)
                .nextUpdateAt(nextUpdateAt)
                .classificationMethod(classificationMethod)
                .visibility(visibility)
                .ownerUserId(ownerUserId)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .indexedAt(indexedAt);
    }

    /**
     * Mutable builder used by the store mapper, ingestion and tests.
     */
    public static final class Builder {
        private String id;
        private String slug;
        private RepositoryIdentity identity;
        private String name;
        private String description;
        private int stars;
        private int forks;
        private List<StarSnapshot> starSnapshots = List.of();
        private double trendingScore;
        private Instant lastCommitAt;
        private String contentHash;
        private String contentCommitSha;
        private SkillTier tier = SkillTier.COLD;
        private Instant lastAccessedAt;
        private int accessCount7d;
        private int accessCount30d;
        private int downloadCount7d;
        private int downloadCount30d;
        private Instant nextUpdateAt;
        private ClassificationMethod classificationMethod;
        private Visibility visibility = Visibility.PUBLIC;
        private String ownerUserId;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant indexedAt;

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder slug(String slug) { this.slug = slug; return this; }
        public Builder identity(RepositoryIdentity identity) { this.identity = identity; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder stars(int stars) { this.stars = stars; return this; }
        public Builder forks(int forks) { this.forks = forks; return this; }
        public Builder starSnapshots(List<StarSnapshot> starSnapshots) { this.starSnapshots = starSnapshots; return this; }
        public Builder trendingScore(double trendingScore) { this.trendingScore = trendingScore; return this; }
        public Builder lastCommitAt(Instant lastCommitAt) { this.lastCommitAt = lastCommitAt; return this; }
        public Builder contentHash(String contentHash) { this.contentHash = contentHash; return this; }
        public Builder contentCommitSha(String contentCommitSha) { this.contentCommitSha = contentCommitSha; return this; }
        public Builder tier(SkillTier tier) { this.tier = tier; return this; }
        public Builder lastAccessedAt(Instant lastAccessedAt) { this.lastAccessedAt = lastAccessedAt; return this; }
        public Builder accessCount7d(int accessCount7d) { this.accessCount7d = accessCount7d; return this; }
        public Builder accessCount30d(int accessCount30d) { this.accessCount30d = accessCount30d; return this; }
        public Builder downloadCount7d(int downloadCount7d) { this.downloadCount7d = downloadCount7d; return this; }
        public Builder downloadCount30d(int downloadCount30d) { this.downloadCount30d = downloadCount30d; return this; }
        public Builder nextUpdateAt(Instant nextUpdateAt) { this.nextUpdateAt = nextUpdateAt; return this; }
        public Builder classificationMethod(ClassificationMethod classificationMethod) { this.classificationMethod = classificationMethod; return this; }
        public Builder visibility(Visibility visibility) { this.visibility = visibility; return this; }
        public Builder ownerUserId(String ownerUserId) { this.ownerUserId = ownerUserId; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder indexedAt(Instant indexedAt) { this.indexedAt = indexedAt; return this; }

        public SkillRecord build() {
            return new SkillRecord(id, slug, identity, name, description, stars, forks, starSnapshots,
                    trendingScore, lastCommitAt, contentHash, contentCommitSha, tier, lastAccessedAt,
                    accessCount7d, accessCount30d, downloadCount7d, downloadCount30d, nextUpdateAt,
                    classificationMethod, visibility, ownerUserId, createdAt, updatedAt, indexedAt);
        }
    }
}
