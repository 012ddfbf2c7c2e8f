package com.williamcallahan.skillcatalog.service.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.ArchiveSnapshot;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.RepositoryMetadata;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.queue.PipelineJob;
import com.williamcallahan.skillcatalog.service.github.GitHubApiException;
import com.williamcallahan.skillcatalog.service.github.RepositoryMetadataClient;
import com.williamcallahan.skillcatalog.service.ingestion.MarkerFileLocator;
import com.williamcallahan.skillcatalog.service.metrics.PipelineMetrics;
import com.williamcallahan.skillcatalog.store.BlobStore;
import com.williamcallahan.skillcatalog.store.BlobStoreException;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Brings archived records back to the cold tier when they show renewed interest.
 *
 * <p>The quarterly sweep and the on-demand check share one qualification rule and differ only
 * in the star threshold. A resubmission resurrects without any check.</p>
 */
@Service
public class ResurrectionService implements PipelineJob<Instant> {
    private static final Logger log = LoggerFactory.getLogger(ResurrectionService.class);
    static final String METRICS_STAGE = "resurrection";

    private final SkillStore skillStore;
    private final BlobStore blobStore;
    private final RepositoryMetadataClient metadataClient;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final PipelineMetrics pipelineMetrics;

    public ResurrectionService(
            SkillStore skillStore,
            BlobStore blobStore,
            RepositoryMetadataClient metadataClient,
            ObjectMapper objectMapper,
            AppProperties appProperties,
            PipelineMetrics pipelineMetrics) {
        this.skillStore = skillStore;
        this.blobStore = blobStore;
        this.metadataClient = metadataClient;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
        this.pipelineMetrics = pipelineMetrics;
    }

    /**
     * Counters of one sweep.
     */
    public record SweepReport(int checked, int resurrected, int failed, int githubCalls) {
        Map<String, Long> asCounters() {
            Map<String, Long> counters = new LinkedHashMap<>();
            counters.put("checked", (long) checked);
            counters.put("resurrected", (long) resurrected);
            counters.put("failed", (long) failed);
            counters.put("githubCalls", (long) githubCalls);
            return counters;
        }
    }

    @Override
    public String jobName() {
        return "resurrection-sweep";
    }

    @Override
    public void execute(Instant now) {
        sweep(now);
    }

    /**
     * Checks every archived record against the sweep threshold, one metadata batch at a time.
     */
    public SweepReport sweep(Instant now) {
        AppProperties.Resurrection settings = appProperties.getResurrection();
        int checked = 0;
        int resurrected = 0;
        int failed = 0;
        int githubCalls = 0;
        String afterId = null;
        boolean firstBatch = true;

        while (true) {
            List<SkillRecord> page = skillStore.findArchived(afterId, settings.getBatchSize());
            if (page.isEmpty()) {
                break;
            }
            afterId = page.get(page.size() - 1).id();
            if (!firstBatch) {
                pause(settings.getInterBatchDelay());
            }
            firstBatch = false;

            Map<String, RepositoryMetadata> metadata;
            try {
                githubCalls++;
                metadata = metadataClient.fetchRepositories(
                        page.stream().map(SkillRecord::identity).collect(Collectors.toList()));
            } catch (GitHubApiException batchFailure) {
                log.warn("Resurrection batch after {} failed, skipping {} records: {}",
                        afterId, page.size(), batchFailure.getMessage());
                checked += page.size();
                failed += page.size();
                continue;
            }

            for (SkillRecord archived : page) {
                checked++;
                RepositoryMetadata current = metadata.get(archived.identity().repoKey());
                if (current == null || !qualifies(current, settings.getSweepStarThreshold(), now)) {
                    continue;
                }
                try {
                    resurrect(archived, current, now);
                    resurrected++;
                } catch (RuntimeException resurrectionFailure) {
                    failed++;
                    log.error("Failed to resurrect {}", archived.slug(), resurrectionFailure);
                }
            }
        }

        SweepReport report = new SweepReport(checked, resurrected, failed, githubCalls);
        pipelineMetrics.record(METRICS_STAGE, PipelineMetrics.quarterly(now), PipelineMetrics.RESURRECTION_TTL,
                report.asCounters());
        log.info("Resurrection sweep checked {} archived records, resurrected {}, failed {}",
                checked, resurrected, failed);
        return report;
    }

    /**
     * Visit-triggered check using the lower star threshold.
     *
     * @return true when the record was resurrected
     */
    public boolean checkOnDemand(SkillRecord archived, Instant now) {
        if (!archived.isArchived()) {
            return false;
        }
        RepositoryIdentity identity = archived.identity();
        Optional<RepositoryMetadata> current = metadataClient.fetchRepository(identity.owner(), identity.name());
        if (current.isEmpty()) {
            log.info("Archived {} no longer resolves, leaving it archived", identity.displayKey());
            return false;
        }
        if (!qualifies(current.get(), appProperties.getResurrection().getOnDemandStarThreshold(), now)) {
            return false;
        }
        resurrect(archived, current.get(), now);
        return true;
    }

    /**
     * Resurrects an archived record that was explicitly resubmitted.
     */
    public void resurrectOnResubmission(SkillRecord archived, Instant now) {
        if (archived.isArchived()) {
            resurrect(archived, null, now);
        }
    }

    boolean qualifies(RepositoryMetadata metadata, int starThreshold, Instant now) {
        if (metadata.stars() >= starThreshold) {
            return true;
        }
        Duration activityWindow = Duration.ofDays(appProperties.getResurrection().getActivityWindowDays());
        return metadata.pushedAt() != null && metadata.pushedAt().isAfter(now.minus(activityWindow));
    }

    private void resurrect(SkillRecord archived, RepositoryMetadata current, Instant now) {
        String archiveKey = ArchiveSnapshot.blobKey(archived);
        Optional<ArchiveSnapshot> snapshot = blobStore.getText(archiveKey).map(json -> readSnapshot(archiveKey, json));
        if (snapshot.isEmpty()) {
            log.warn("No archive blob for {}, resurrecting without cached content", archived.slug());
        }

        snapshot.filter(archive -> archive.skillMdContent() != null)
                .ifPresent(archive -> blobStore.putText(
                        archived.identity().blobPrefix() + "/" + markerFileName(archive), archive.skillMdContent()));
        if (current != null) {
            skillStore.updatePopularity(archived.id(), current.stars(), current.forks(), current.pushedAt(), now);
        }
        skillStore.markResurrected(
                archived.id(),
                snapshot.map(ArchiveSnapshot::categories).orElse(List.of()),
                snapshot.map(ArchiveSnapshot::starSnapshots).orElse(List.of()),
                now);
        if (snapshot.isPresent()) {
            blobStore.delete(archiveKey);
        }
        log.info("Resurrected {} to the cold tier", archived.slug());
    }

    private static String markerFileName(ArchiveSnapshot snapshot) {
        return MarkerFileLocator.MARKER_FILE_NAMES.contains(snapshot.skillMdFileName())
                ? snapshot.skillMdFileName()
                : ArchiveSnapshot.DEFAULT_MARKER_FILE_NAME;
    }

    private ArchiveSnapshot readSnapshot(String key, String json) {
        try {
            return objectMapper.readValue(json, ArchiveSnapshot.class);
        } catch (JsonProcessingException corrupt) {
            throw new BlobStoreException("Unreadable archive blob " + key, corrupt);
        }
    }

    private static void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Resurrection sweep interrupted", interrupted);
        }
    }
}
