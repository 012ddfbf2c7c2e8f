package com.williamcallahan.skillcatalog.service.trending;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.skillcatalog.domain.StarSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Verifies the composite trending score and each of its factors.
 */
class TrendingScoreCalculatorTest {

    private static final Instant NOW = Instant.parse("2025-01-31T12:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 1, 31);

    private final TrendingScoreCalculator calculator = new TrendingScoreCalculator();

    @Test
    void baseScoreIsZeroForZeroStarsAndNeverDecreases() {
        assertEquals(0.0, TrendingScoreCalculator.baseScore(0));
        double previous = 0.0;
        for (int stars = 1; stars <= 5000; stars += 7) {
            double current = TrendingScoreCalculator.baseScore(stars);
            assertTrue(current >= previous, "baseScore must not decrease at " + stars);
            previous = current;
        }
    }

    @Test
    void freshRecordWithoutHistoryGetsOnlyRecencyBoost() {
        double score = calculator.calculate(99, List.of(), NOW, null, 0, NOW);

        assertEquals(30.0, score, 0.001);
    }

    @Test
    void downloadsRaiseScore() {
        double score = calculator.calculate(99, List.of(), NOW, null, 1, NOW);

        assertEquals(34.5, score, 0.001);
    }

    @Test
    void scoreIsDeterministicForIdenticalInputs() {
        List<StarSnapshot> history = List.of(
                StarSnapshot.of(LocalDate.of(2025, 1, 1), 10),
                StarSnapshot.of(LocalDate.of(2025, 1, 20), 20));
        Instant indexedAt = NOW.minus(Duration.ofDays(3));
        Instant lastPush = NOW.minus(Duration.ofDays(45));

        double first = calculator.calculate(30, history, indexedAt, lastPush, 4, NOW);
        double second = calculator.calculate(30, history, indexedAt, lastPush, 4, NOW);

        assertEquals(first, second);
        assertTrue(first > TrendingScoreCalculator.baseScore(30), "growing record should beat its base score");
    }

    @Test
    void starsDaysAgoUsesLatestSnapshotOnOrBeforeTargetDate() {
        List<StarSnapshot> history = List.of(
                StarSnapshot.of(LocalDate.of(2025, 1, 1), 10),
                StarSnapshot.of(LocalDate.of(2025, 1, 20), 20));

        assertEquals(20, TrendingScoreCalculator.starsDaysAgo(history, 30, 7, TODAY));
        assertEquals(10, TrendingScoreCalculator.starsDaysAgo(history, 30, 30, TODAY));
        assertEquals(10, TrendingScoreCalculator.starsDaysAgo(history, 30, 60, TODAY));
        assertEquals(30, TrendingScoreCalculator.starsDaysAgo(List.of(), 30, 7, TODAY));
    }

    @Test
    void accelerationKeepsBoundaryAtThirtyDayRateOfPointOne() {
        assertEquals(1.0, TrendingScoreCalculator.acceleration(0.0, 0.1));
        assertEquals(2.0, TrendingScoreCalculator.acceleration(0.5, 0.1));
        assertEquals(2.0, TrendingScoreCalculator.acceleration(1.0, 0.5));
    }

    @Test
    void velocityMultiplierIsClamped() {
        assertEquals(1.0, TrendingScoreCalculator.velocityMultiplier(0.0, 0.0));
        assertEquals(1.8, TrendingScoreCalculator.velocityMultiplier(1.0, 0.0), 0.0001);
        assertEquals(5.0, TrendingScoreCalculator.velocityMultiplier(10_000.0, 1.0));
    }

    @Test
    void recencyBoostDecaysToOneAfterTwoWeeks() {
        assertEquals(1.5, TrendingScoreCalculator.recencyBoost(NOW, NOW));
        assertEquals(1.0, TrendingScoreCalculator.recencyBoost(NOW.minus(Duration.ofDays(7)), NOW), 0.0001);
        assertEquals(1.0, TrendingScoreCalculator.recencyBoost(NOW.minus(Duration.ofDays(30)), NOW));
    }

    @ParameterizedTest(name = "{0} days since push -> {1}")
    @CsvSource({
        "0, 1.0",
        "30, 1.0",
        "31, 0.9",
        "90, 0.9",
        "91, 0.7",
        "180, 0.7",
        "181, 0.5",
        "365, 0.5",
        "366, 0.3"
    })
    void activityPenaltyFollowsPushAge(long days, double expected) {
        assertEquals(expected, TrendingScoreCalculator.activityPenalty(NOW.minus(Duration.ofDays(days)), NOW));
    }

    @Test
    void partialDaysPastABoundaryCountAgainstThePush() {
        Instant justOverThirtyDays = NOW.minus(Duration.ofDays(30)).minus(Duration.ofHours(22));
        Instant justOverAYear = NOW.minus(Duration.ofDays(365)).minus(Duration.ofHours(1));

        assertEquals(0.9, TrendingScoreCalculator.activityPenalty(justOverThirtyDays, NOW));
        assertEquals(0.3, TrendingScoreCalculator.activityPenalty(justOverAYear, NOW));
        assertEquals(1.0, TrendingScoreCalculator.activityPenalty(NOW.minus(Duration.ofDays(30)), NOW));
    }

    @Test
    void unknownPushIsNeutral() {
        assertEquals(1.0, TrendingScoreCalculator.activityPenalty(null, NOW));
    }

    @Test
    void downloadBoostIsCapped() {
        assertEquals(1.0, TrendingScoreCalculator.downloadBoost(0));
        assertEquals(2.0, TrendingScoreCalculator.downloadBoost(1_000_000));
    }
}
