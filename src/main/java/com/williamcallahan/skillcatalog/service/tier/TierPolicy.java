package com.williamcallahan.skillcatalog.service.tier;

import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.domain.SkillTier;
import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Pure tier assignment from stars, last access and evaluation time.
 *
 * <p>Never returns {@link SkillTier#ARCHIVED}; only the archiver moves records there.</p>
 */
@Component
public class TierPolicy {
    static final int HOT_MIN_STARS = 1000;
    static final int WARM_MIN_STARS = 100;
    static final int COOL_MIN_STARS = 10;
    static final Duration HOT_ACCESS_WINDOW = Duration.ofDays(7);
    static final Duration WARM_ACCESS_WINDOW = Duration.ofDays(30);
    static final Duration COOL_ACCESS_WINDOW = Duration.ofDays(90);
    static final Duration COLD_STALE_ACCESS = Duration.ofDays(30);

    /**
     * Assigns the refresh tier.
     *
     * @param stars current stars
     * @param lastAccessedAt last access, or null when never accessed
     * @param now evaluation time
     * @return hot, warm, cool or cold
     */
    public SkillTier assign(int stars, Instant lastAccessedAt, Instant now) {
        if (stars >= HOT_MIN_STARS || accessedWithin(lastAccessedAt, now, HOT_ACCESS_WINDOW)) {
            return SkillTier.HOT;
        }
        if (stars >= WARM_MIN_STARS || accessedWithin(lastAccessedAt, now, WARM_ACCESS_WINDOW)) {
            return SkillTier.WARM;
        }
        if (stars >= COOL_MIN_STARS || accessedWithin(lastAccessedAt, now, COOL_ACCESS_WINDOW)) {
            return SkillTier.COOL;
        }
        return SkillTier.COLD;
    }

    /**
     * Returns true when a visit should request a refresh: the record is due, or it is cold and
     * has not been accessed for thirty days.
     */
    public boolean isDueOnAccess(SkillRecord skill, Instant now) {
        if (skill.nextUpdateAt() == null || !skill.nextUpdateAt().isAfter(now)) {
            return true;
        }
        return skill.tier() == SkillTier.COLD && !accessedWithin(skill.lastAccessedAt(), now, COLD_STALE_ACCESS);
    }

    private static boolean accessedWithin(Instant lastAccessedAt, Instant now, Duration window) {
        return lastAccessedAt != null && Duration.between(lastAccessedAt, now).compareTo(window) < 0;
    }
}
