package com.williamcallahan.skillcatalog.queue;

import com.williamcallahan.skillcatalog.service.archive.ArchiveService;
import com.williamcallahan.skillcatalog.service.archive.ResurrectionService;
import com.williamcallahan.skillcatalog.service.publish.ListingCachePublisher;
import com.williamcallahan.skillcatalog.service.tier.DownloadAggregationService;
import com.williamcallahan.skillcatalog.service.tier.TierRefreshScheduler;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cron triggers for the time-driven stages. Each run that changes records republishes the
 * listing caches afterwards.
 */
@Component
public class ScheduledJobs {
    private static final Logger log = LoggerFactory.getLogger(ScheduledJobs.class);

    private final TierRefreshScheduler tierRefreshScheduler;
    private final DownloadAggregationService downloadAggregationService;
    private final ArchiveService archiveService;
    private final ResurrectionService resurrectionService;
    private final ListingCachePublisher listingCachePublisher;
    private final Clock clock;

    public ScheduledJobs(
            TierRefreshScheduler tierRefreshScheduler,
            DownloadAggregationService downloadAggregationService,
            ArchiveService archiveService,
            ResurrectionService resurrectionService,
            ListingCachePublisher listingCachePublisher,
            Clock clock) {
        this.tierRefreshScheduler = tierRefreshScheduler;
        this.downloadAggregationService = downloadAggregationService;
        this.archiveService = archiveService;
        this.resurrectionService = resurrectionService;
        this.listingCachePublisher = listingCachePublisher;
        this.clock = clock;
    }

    @Scheduled(cron = "${app.tiers.refresh-cron}", zone = "UTC")
    public void refreshTiers() {
        runThenPublish(tierRefreshScheduler);
    }

    @Scheduled(cron = "${app.tiers.aggregation-cron}", zone = "UTC")
    public void aggregateDownloads() {
        run(downloadAggregationService);
    }

    @Scheduled(cron = "${app.archive.cron}", zone = "UTC")
    public void archiveInactive() {
        runThenPublish(archiveService);
    }

    @Scheduled(cron = "${app.resurrection.cron}", zone = "UTC")
    public void sweepArchived() {
        runThenPublish(resurrectionService);
    }

    private void runThenPublish(PipelineJob<Instant> job) {
        if (run(job)) {
            run(listingCachePublisher);
        }
    }

    private boolean run(PipelineJob<Instant> job) {
        try {
            job.execute(clock.instant());
            return true;
        } catch (RuntimeException jobFailure) {
            log.error("Scheduled job {} failed", job.jobName(), jobFailure);
            return false;
        }
    }
}
