package com.williamcallahan.skillcatalog.service.tier;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.service.archive.ResurrectionService;
import com.williamcallahan.skillcatalog.store.FlagStore;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records detail-page visits and downloads reported by the web layer.
 *
 * <p>A visit to a stale record leaves a refresh flag for the next tier pass; a visit to an
 * archived record runs the on-demand resurrection check. Both side effects happen at most once
 * per record every fifteen minutes.</p>
 */
@Service
public class SkillAccessService {
    private static final Logger log = LoggerFactory.getLogger(SkillAccessService.class);
    static final Duration REQUEST_DEDUPE_WINDOW = Duration.ofMinutes(15);
    static final Duration FLAG_TTL = Duration.ofHours(1);

    private final SkillStore skillStore;
    private final FlagStore flagStore;
    private final TierPolicy tierPolicy;
    private final ResurrectionService resurrectionService;
    private final Clock clock;
    private final Cache<String, Boolean> recentRequests = Caffeine.newBuilder()
            .expireAfterWrite(REQUEST_DEDUPE_WINDOW)
            .maximumSize(100_000)
            .build();

    public SkillAccessService(
            SkillStore skillStore,
            FlagStore flagStore,
            TierPolicy tierPolicy,
            ResurrectionService resurrectionService,
            Clock clock) {
        this.skillStore = skillStore;
        this.flagStore = flagStore;
        this.tierPolicy = tierPolicy;
        this.resurrectionService = resurrectionService;
        this.clock = clock;
    }

    public void recordAccess(String skillId) {
        Optional<SkillRecord> found = skillStore.findById(skillId);
        if (found.isEmpty()) {
            log.debug("Ignoring access to unknown skill {}", skillId);
            return;
        }
        SkillRecord skill = found.get();
        Instant now = clock.instant();
        skillStore.recordAccess(skillId, now);

        if (skill.isArchived()) {
            if (firstRequestInWindow(skillId)) {
                resurrectionService.checkOnDemand(skill, now);
            }
            return;
        }
        if (tierPolicy.isDueOnAccess(skill, now) && firstRequestInWindow(skillId)) {
            flagStore.put(TierRefreshScheduler.NEEDS_UPDATE_PREFIX + skillId, String.valueOf(now.toEpochMilli()), FLAG_TTL);
        }
    }

    public void recordDownload(String skillId) {
        skillStore.recordDownload(skillId, clock.instant());
    }

    private boolean firstRequestInWindow(String skillId) {
        return recentRequests.asMap().putIfAbsent(skillId, Boolean.TRUE) == null;
    }
}
