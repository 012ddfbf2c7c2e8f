package com.williamcallahan.skillcatalog.service.tier;

import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.queue.PipelineJob;
import com.williamcallahan.skillcatalog.service.metrics.PipelineMetrics;
import com.williamcallahan.skillcatalog.store.FlagStore;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rolls raw download events into per-record counters and prunes old events, once per UTC day.
 */
@Service
public class DownloadAggregationService implements PipelineJob<Instant> {
    private static final Logger log = LoggerFactory.getLogger(DownloadAggregationService.class);
    static final String GUARD_PREFIX = "aggregation:downloads:";
    static final Duration GUARD_TTL = Duration.ofHours(36);

    private final SkillStore skillStore;
    private final FlagStore flagStore;
    private final AppProperties appProperties;

    public DownloadAggregationService(SkillStore skillStore, FlagStore flagStore, AppProperties appProperties) {
        this.skillStore = skillStore;
        this.flagStore = flagStore;
        this.appProperties = appProperties;
    }

    @Override
    public String jobName() {
        return "download-aggregation";
    }

    @Override
    public void execute(Instant now) {
        aggregate(now);
    }

    /**
     * Runs the daily aggregation unless it already ran today.
     *
     * @return true when the aggregation ran
     */
    public boolean aggregate(Instant now) {
        String guardKey = GUARD_PREFIX + PipelineMetrics.daily(now);
        if (!flagStore.putIfAbsent(guardKey, String.valueOf(now.toEpochMilli()), GUARD_TTL)) {
            log.debug("Download aggregation already ran for {}", guardKey);
            return false;
        }
        try {
            int counted = skillStore.refreshDownloadCounts(now);
            int pruned = skillStore.pruneDownloadEvents(
                    now.minus(Duration.ofDays(appProperties.getTiers().getDownloadRetentionDays())));
            int reset = skillStore.resetStaleAccessCounts(now);
            log.info("Download aggregation updated {} records, pruned {} events, reset {} access counters",
                    counted, pruned, reset);
            return true;
        } catch (RuntimeException aggregationFailure) {
            flagStore.delete(guardKey);
            throw aggregationFailure;
        }
    }
}
