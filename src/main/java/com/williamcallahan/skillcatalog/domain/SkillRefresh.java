package com.williamcallahan.skillcatalog.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Recomputed popularity, score and schedule for one record, written by the tier refresh.
 *
 * @param skillId record id
 * @param stars refreshed star count
 * @param forks refreshed fork count
 * @param starSnapshots compressed star history
 * @param lastCommitAt last push time, may be null
 * @param trendingScore recomputed score
 * @param tier newly assigned tier
 * @param nextUpdateAt next scheduled update, null for cold
 * @param updatedAt write time
 */
public record SkillRefresh(
        String skillId,
        int stars,
        int forks,
        List<StarSnapshot> starSnapshots,
        Instant lastCommitAt,
        double trendingScore,
        SkillTier tier,
        Instant nextUpdateAt,
        Instant updatedAt) {

    public SkillRefresh {
        Objects.requireNonNull(skillId, "skillId");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (tier == SkillTier.ARCHIVED) {
            throw new IllegalArgumentException("A refresh never moves a record into the archived tier");
        }
        starSnapshots = starSnapshots == null ? List.of() : List.copyOf(starSnapshots);
    }
}
