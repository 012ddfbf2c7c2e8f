package com.williamcallahan.skillcatalog.service.trending;

import com.williamcallahan.skillcatalog.domain.StarSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Composite popularity score.
 *
 * <p>{@code score = base x velocity x recency x activity x downloads}, rounded to two decimals.
 * Deterministic for identical inputs and evaluation time.</p>
 */
@Component
public class TrendingScoreCalculator {
    private static final double MS_PER_DAY = Duration.ofDays(1).toMillis();
    private static final double ACCELERATION_RATE_FLOOR = 0.1;
    private static final double MAX_ACCELERATION = 3.0;
    private static final double VELOCITY_WEIGHT = 0.4;
    private static final double MIN_VELOCITY = 1.0;
    private static final double MAX_VELOCITY = 5.0;
    private static final double MAX_RECENCY_BOOST = 1.5;
    private static final double RECENCY_DECAY_DAYS = 14.0;
    private static final double DOWNLOAD_WEIGHT = 0.15;
    private static final double MAX_DOWNLOAD_BOOST = 2.0;

    /**
     * Computes the trending score of one record.
     *
     * @param stars current stars
     * @param snapshots star history, oldest first
     * @param indexedAt when the record was indexed
     * @param lastCommitAt last push, or null when unknown
     * @param downloads7d downloads over the last seven days
     * @param now evaluation time
     * @return score rounded to two decimals
     */
    public double calculate(
            int stars, List<StarSnapshot> snapshots, Instant indexedAt, Instant lastCommitAt, int downloads7d, Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        double dailyGrowth7d = Math.max(0, (stars - starsDaysAgo(snapshots, stars, 7, today)) / 7.0);
        double dailyGrowth30d = Math.max(0, (stars - starsDaysAgo(snapshots, stars, 30, today)) / 30.0);

        double score = baseScore(stars)
                * velocityMultiplier(dailyGrowth7d, dailyGrowth30d)
                * recencyBoost(indexedAt, now)
                * activityPenalty(lastCommitAt, now)
                * downloadBoost(downloads7d);
        return Math.round(score * 100.0) / 100.0;
    }

    /**
     * Logarithmic scale term: {@code log10(stars + 1) * 10}.
     */
    public static double baseScore(int stars) {
        return Math.log10(Math.max(0, stars) + 1.0) * 10.0;
    }

    /**
     * Returns the stars of the most recent snapshot dated on or before {@code days} ago, falling
     * back to the earliest snapshot, or to the current stars when there is no history.
     */
    public static int starsDaysAgo(List<StarSnapshot> snapshots, int currentStars, int days, LocalDate today) {
        if (snapshots == null || snapshots.isEmpty()) {
            return currentStars;
        }
        String target = today.minusDays(days).toString();
        for (int index = snapshots.size() - 1; index >= 0; index--) {
            StarSnapshot snapshot = snapshots.get(index);
            if (snapshot.date().compareTo(target) <= 0) {
                return snapshot.stars();
            }
        }
        return snapshots.get(0).stars();
    }

    static double acceleration(double dailyGrowth7d, double dailyGrowth30d) {
        if (dailyGrowth30d > ACCELERATION_RATE_FLOOR) {
            return dailyGrowth7d / dailyGrowth30d;
        }
        return dailyGrowth7d > 0 ? 2.0 : 1.0;
    }

    static double velocityMultiplier(double dailyGrowth7d, double dailyGrowth30d) {
        double acceleration = Math.min(acceleration(dailyGrowth7d, dailyGrowth30d), MAX_ACCELERATION);
        double velocity = 1.0 + log2(dailyGrowth7d + 1) * acceleration * VELOCITY_WEIGHT;
        return Math.min(MAX_VELOCITY, Math.max(MIN_VELOCITY, velocity));
    }

    static double recencyBoost(Instant indexedAt, Instant now) {
        if (indexedAt == null) {
            return 1.0;
        }
        double daysSinceIndexed = (now.toEpochMilli() - indexedAt.toEpochMilli()) / MS_PER_DAY;
        return Math.max(1.0, MAX_RECENCY_BOOST - daysSinceIndexed / RECENCY_DECAY_DAYS);
    }

    static double activityPenalty(Instant lastCommitAt, Instant now) {
        if (lastCommitAt == null) {
            return 1.0;
        }
        double daysSincePush = (now.toEpochMilli() - lastCommitAt.toEpochMilli()) / MS_PER_DAY;
        if (daysSincePush <= 30) {
            return 1.0;
        }
        if (daysSincePush <= 90) {
            return 0.9;
        }
        if (daysSincePush <= 180) {
            return 0.7;
        }
        if (daysSincePush <= 365) {
            return 0.5;
        }
        return 0.3;
    }

    static double downloadBoost(int downloads7d) {
        return Math.min(MAX_DOWNLOAD_BOOST, 1.0 + log2(Math.max(0, downloads7d) + 1.0) * DOWNLOAD_WEIGHT);
    }

    private static double log2(double value) {
        return Math.log(value) / Math.log(2);
    }
}
