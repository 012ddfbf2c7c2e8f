package com.williamcallahan.skillcatalog.service.tier;

import com.google.common.collect.Lists;
import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.RepositoryMetadata;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.domain.SkillRefresh;
import com.williamcallahan.skillcatalog.domain.SkillTier;
import com.williamcallahan.skillcatalog.domain.StarSnapshot;
import com.williamcallahan.skillcatalog.queue.PipelineJob;
import com.williamcallahan.skillcatalog.service.github.GitHubApiException;
import com.williamcallahan.skillcatalog.service.github.RepositoryMetadataClient;
import com.williamcallahan.skillcatalog.service.metrics.PipelineMetrics;
import com.williamcallahan.skillcatalog.service.trending.SnapshotCompressor;
import com.williamcallahan.skillcatalog.service.trending.TrendingScoreCalculator;
import com.williamcallahan.skillcatalog.store.FlagStore;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hourly re-scoring pass over flagged and due records.
 *
 * <p>Groups are processed in priority order: records flagged by visitors, then due hot, warm
 * and cool records, each under its own cap. Each group is split into metadata batches; a batch
 * whose lookup fails is still re-scored from the stored values and rescheduled. Every batch is
 * written as one atomic unit, so groups that completed stay durable if a later one fails.</p>
 */
@Service
public class TierRefreshScheduler implements PipelineJob<Instant> {
    private static final Logger log = LoggerFactory.getLogger(TierRefreshScheduler.class);

    /** Flag-store key prefix for visitor refresh requests. */
    public static final String NEEDS_UPDATE_PREFIX = "needs_update:";
    static final String METRICS_STAGE = "tier-refresh";

    private final SkillStore skillStore;
    private final FlagStore flagStore;
    private final RepositoryMetadataClient metadataClient;
    private final TrendingScoreCalculator trendingScoreCalculator;
    private final SnapshotCompressor snapshotCompressor;
    private final TierPolicy tierPolicy;
    private final ReclassificationDetector reclassificationDetector;
    private final AppProperties appProperties;
    private final PipelineMetrics pipelineMetrics;

    public TierRefreshScheduler(
            SkillStore skillStore,
            FlagStore flagStore,
            RepositoryMetadataClient metadataClient,
            TrendingScoreCalculator trendingScoreCalculator,
            SnapshotCompressor snapshotCompressor,
            TierPolicy tierPolicy,
            ReclassificationDetector reclassificationDetector,
            AppProperties appProperties,
            PipelineMetrics pipelineMetrics) {
        this.skillStore = skillStore;
        this.flagStore = flagStore;
        this.metadataClient = metadataClient;
        this.trendingScoreCalculator = trendingScoreCalculator;
        this.snapshotCompressor = snapshotCompressor;
        this.tierPolicy = tierPolicy;
        this.reclassificationDetector = reclassificationDetector;
        this.appProperties = appProperties;
        this.pipelineMetrics = pipelineMetrics;
    }

    /**
     * Counters of one pass.
     */
    public record RefreshReport(int flagged, int hot, int warm, int cool, int stale, int reclassified) {
        public int total() {
            return flagged + hot + warm + cool;
        }
    }

    @Override
    public String jobName() {
        return "tier-refresh";
    }

    @Override
    public void execute(Instant now) {
        refresh(now);
    }

    public RefreshReport refresh(Instant now) {
        AppProperties.Tiers caps = appProperties.getTiers();
        Set<String> processed = new HashSet<>();
        GroupResult flagged = refreshFlagged(caps.getFlaggedCap(), processed, now);
        GroupResult hot = refreshGroup(due(SkillTier.HOT, caps.getHotCap(), processed, now), processed, now);
        GroupResult warm = refreshGroup(due(SkillTier.WARM, caps.getWarmCap(), processed, now), processed, now);
        GroupResult cool = refreshGroup(due(SkillTier.COOL, caps.getCoolCap(), processed, now), processed, now);

        RefreshReport report = new RefreshReport(
                flagged.refreshed, hot.refreshed, warm.refreshed, cool.refreshed,
                flagged.stale + hot.stale + warm.stale + cool.stale,
                flagged.reclassified + hot.reclassified + warm.reclassified + cool.reclassified);
        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("flagged", (long) report.flagged());
        counters.put("hot", (long) report.hot());
        counters.put("warm", (long) report.warm());
        counters.put("cool", (long) report.cool());
        counters.put("stale", (long) report.stale());
        counters.put("reclassified", (long) report.reclassified());
        counters.put("total", (long) report.total());
        pipelineMetrics.record(METRICS_STAGE, PipelineMetrics.daily(now), PipelineMetrics.TIER_REFRESH_TTL, counters);
        log.info("Tier refresh updated {} records (flagged {}, hot {}, warm {}, cool {}, stale {})",
                report.total(), report.flagged(), report.hot(), report.warm(), report.cool(), report.stale());
        return report;
    }

    private GroupResult refreshFlagged(int cap, Set<String> processed, Instant now) {
        List<String> flagKeys = flagStore.listKeys(NEEDS_UPDATE_PREFIX, cap);
        if (flagKeys.isEmpty()) {
            return new GroupResult();
        }
        List<String> skillIds = flagKeys.stream()
                .map(key -> key.substring(NEEDS_UPDATE_PREFIX.length()))
                .collect(Collectors.toList());
        List<SkillRecord> flagged = skillStore.findByIds(skillIds).stream()
                .filter(skill -> !skill.isArchived())
                .collect(Collectors.toList());
        GroupResult result = refreshGroup(flagged, processed, now);
        flagKeys.forEach(flagStore::delete);
        return result;
    }

    private List<SkillRecord> due(SkillTier tier, int cap, Set<String> processed, Instant now) {
        return skillStore.findDueByTier(tier, now, cap).stream()
                .filter(skill -> !processed.contains(skill.id()))
                .collect(Collectors.toList());
    }

    private GroupResult refreshGroup(List<SkillRecord> records, Set<String> processed, Instant now) {
        GroupResult result = new GroupResult();
        int batchSize = appProperties.getGithub().getGraphqlBatchSize();
        for (List<SkillRecord> batch : Lists.partition(records, batchSize)) {
            Map<String, RepositoryMetadata> metadata;
            try {
                metadata = metadataClient.fetchRepositories(
                        batch.stream().map(SkillRecord::identity).collect(Collectors.toList()));
            } catch (GitHubApiException batchFailure) {
                log.warn("Metadata batch of {} failed, re-scoring from stored values: {}",
                        batch.size(), batchFailure.getMessage());
                metadata = Map.of();
            }

            List<SkillRefresh> refreshes = new ArrayList<>(batch.size());
            for (SkillRecord skill : batch) {
                RepositoryMetadata current = metadata.get(skill.identity().repoKey());
                if (current == null) {
                    result.stale++;
                }
                refreshes.add(recompute(skill, current, now));
            }
            skillStore.applyRefreshes(refreshes);

            for (int index = 0; index < batch.size(); index++) {
                processed.add(batch.get(index).id());
                if (reclassificationDetector.checkCrossing(batch.get(index), refreshes.get(index))) {
                    result.reclassified++;
                }
            }
            result.refreshed += batch.size();
        }
        return result;
    }

    SkillRefresh recompute(SkillRecord skill, RepositoryMetadata current, Instant now) {
        int stars = current != null ? current.stars() : skill.stars();
        int forks = current != null ? current.forks() : skill.forks();
        Instant lastCommitAt = current != null ? current.pushedAt() : skill.lastCommitAt();
        List<StarSnapshot> snapshots = current != null
                ? snapshotCompressor.record(skill.starSnapshots(), stars, LocalDate.ofInstant(now, ZoneOffset.UTC))
                : skill.starSnapshots();
        double score = trendingScoreCalculator.calculate(
                stars, snapshots, skill.indexedAt(), lastCommitAt, skill.downloadCount7d(), now);
        SkillTier tier = tierPolicy.assign(stars, skill.lastAccessedAt(), now);
        return new SkillRefresh(skill.id(), stars, forks, snapshots, lastCommitAt, score, tier,
                tier.nextUpdateAfter(now), now);
    }

    private static final class GroupResult {
        private int refreshed;
        private int stale;
        private int reclassified;
    }
}
