package com.williamcallahan.skillcatalog.service.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.ArchiveSnapshot;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.queue.PipelineJob;
import com.williamcallahan.skillcatalog.service.ingestion.MarkerFileLocator;
import com.williamcallahan.skillcatalog.service.metrics.PipelineMetrics;
import com.williamcallahan.skillcatalog.store.BlobStore;
import com.williamcallahan.skillcatalog.store.BlobStoreException;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Moves long-inactive, unpopular records to cold storage.
 *
 * <p>Each record is handled independently: the archive blob is written before the cached
 * marker content is deleted and before the live row is stripped, so a crash part-way leaves a
 * record that the next run selects again and finishes.</p>
 */
@Service
public class ArchiveService implements PipelineJob<Instant> {
    private static final Logger log = LoggerFactory.getLogger(ArchiveService.class);

    static final Duration ACCESS_INACTIVITY = Duration.ofDays(365);
    static final Duration PUSH_INACTIVITY = Duration.ofDays(730);
    static final int STARS_BELOW = 5;
    static final String METRICS_STAGE = "archive";

    private final SkillStore skillStore;
    private final BlobStore blobStore;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final PipelineMetrics pipelineMetrics;

    public ArchiveService(
            SkillStore skillStore,
            BlobStore blobStore,
            ObjectMapper objectMapper,
            AppProperties appProperties,
            PipelineMetrics pipelineMetrics) {
        this.skillStore = skillStore;
        this.blobStore = blobStore;
        this.objectMapper = objectMapper;
        this.appProperties = appProperties;
        this.pipelineMetrics = pipelineMetrics;
    }

    @Override
    public String jobName() {
        return "archive";
    }

    @Override
    public void execute(Instant now) {
        archiveInactive(now);
    }

    /**
     * Archives every eligible record up to the configured batch limit.
     *
     * @return number of records archived
     */
    public int archiveInactive(Instant now) {
        List<SkillRecord> candidates = skillStore.findArchiveCandidates(
                now.minus(ACCESS_INACTIVITY), STARS_BELOW, now.minus(PUSH_INACTIVITY),
                appProperties.getArchive().getBatchLimit());
        int archived = 0;
        int failed = 0;
        for (SkillRecord candidate : candidates) {
            try {
                archive(candidate, now);
                archived++;
            } catch (RuntimeException archiveFailure) {
                failed++;
                log.error("Failed to archive {}", candidate.slug(), archiveFailure);
            }
        }
        pipelineMetrics.record(METRICS_STAGE, PipelineMetrics.monthly(now), PipelineMetrics.ARCHIVE_TTL,
                Map.of("candidates", (long) candidates.size(), "archived", (long) archived, "failed", (long) failed));
        log.info("Archived {} of {} candidates ({} failed)", archived, candidates.size(), failed);
        return archived;
    }

    void archive(SkillRecord skill, Instant now) {
        String archiveKey = ArchiveSnapshot.blobKey(skill);
        String prefix = skill.identity().blobPrefix() + "/";
        String markerName = null;
        String content = null;
        for (String candidateName : MarkerFileLocator.MARKER_FILE_NAMES) {
            Optional<String> cached = blobStore.getText(prefix + candidateName);
            if (cached.isPresent()) {
                markerName = candidateName;
                content = cached.get();
                break;
            }
        }
        if (content == null) {
            Optional<ArchiveSnapshot> earlier = previousSnapshot(archiveKey);
            content = earlier.map(ArchiveSnapshot::skillMdContent).orElse(null);
            markerName = earlier.map(ArchiveSnapshot::skillMdFileName).orElse(null);
        }

        ArchiveSnapshot snapshot = ArchiveSnapshot.capture(
                skill, skillStore.findCategorySlugs(skill.id()), content, markerName, now);
        blobStore.putText(archiveKey, serialize(snapshot));
        for (String candidateName : MarkerFileLocator.MARKER_FILE_NAMES) {
            blobStore.delete(prefix + candidateName);
        }
        skillStore.markArchived(skill.id(), now);
        log.debug("Archived {} to {}", skill.slug(), archiveKey);
    }

    private Optional<ArchiveSnapshot> previousSnapshot(String archiveKey) {
        return blobStore.getText(archiveKey).flatMap(json -> {
            try {
                return Optional.of(objectMapper.readValue(json, ArchiveSnapshot.class));
            } catch (JsonProcessingException corrupt) {
                log.warn("Ignoring unreadable archive blob {}: {}", archiveKey, corrupt.getMessage());
                return Optional.empty();
            }
        });
    }

    private String serialize(ArchiveSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException serializationFailure) {
            throw new BlobStoreException("Could not serialize archive snapshot " + snapshot.id(), serializationFailure);
        }
    }
}
