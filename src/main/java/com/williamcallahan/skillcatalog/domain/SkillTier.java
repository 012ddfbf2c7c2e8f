package com.williamcallahan.skillcatalog.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Refresh tier of a catalog record, controlling how often it is re-evaluated.
 *
 * <p>Cold and archived records are never scheduled proactively; cold records refresh on access
 * and archived records only come back through resurrection.</p>
 */
public enum SkillTier {
    HOT("hot", Duration.ofHours(6)),
    WARM("warm", Duration.ofHours(24)),
    COOL("cool", Duration.ofDays(7)),
    COLD("cold", null),
    ARCHIVED("archived", null);

    private final String wireValue;
    private final Duration refreshInterval;

    SkillTier(String wireValue, Duration refreshInterval) {
        this.wireValue = wireValue;
        this.refreshInterval = refreshInterval;
    }

    /**
     * Returns the lower-case value persisted in the relational store.
     */
    public String wireValue() {
        return wireValue;
    }

    /**
     * Returns the fixed re-update interval, or empty for tiers that are not scheduled.
     */
    public Optional<Duration> refreshInterval() {
        return Optional.ofNullable(refreshInterval);
    }

    /**
     * Computes the next scheduled update for a record that has just been assigned this tier.
     *
     * @param now evaluation time
     * @return next update time, or null when the tier is not proactively scheduled
     */
    public Instant nextUpdateAfter(Instant now) {
        return refreshInterval == null ? null : now.plus(refreshInterval);
    }

    /**
     * Parses a persisted tier value.
     *
     * @param rawValue stored value
     * @return matching tier
     * @throws IllegalArgumentException when the value is unknown
     */
    public static SkillTier fromWireValue(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new IllegalArgumentException("Tier value must not be blank");
        }
        String normalized = rawValue.trim().toLowerCase(Locale.ROOT);
        for (SkillTier tier : values()) {
            if (tier.wireValue.equals(normalized)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown tier: " + rawValue);
    }
}
