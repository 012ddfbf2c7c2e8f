package com.williamcallahan.skillcatalog.service.ingestion;

import com.williamcallahan.skillcatalog.domain.ContentFingerprint;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.RepositoryMetadata;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.domain.SkillTier;
import com.williamcallahan.skillcatalog.domain.StarSnapshot;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationMessage;
import com.williamcallahan.skillcatalog.domain.ingestion.IngestionMessage;
import com.williamcallahan.skillcatalog.domain.ingestion.IngestionOutcome;
import com.williamcallahan.skillcatalog.domain.ingestion.RepositoryFile;
import com.williamcallahan.skillcatalog.domain.ingestion.SkillFile;
import com.williamcallahan.skillcatalog.domain.ingestion.SkillFrontmatter;
import com.williamcallahan.skillcatalog.queue.PipelineJob;
import com.williamcallahan.skillcatalog.queue.WorkQueue;
import com.williamcallahan.skillcatalog.service.archive.ResurrectionService;
import com.williamcallahan.skillcatalog.service.github.RepositoryMetadataClient;
import com.williamcallahan.skillcatalog.service.tier.TierPolicy;
import com.williamcallahan.skillcatalog.service.trending.SnapshotCompressor;
import com.williamcallahan.skillcatalog.service.trending.TrendingScoreCalculator;
import com.williamcallahan.skillcatalog.store.BlobStore;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Admits a repository reference into the catalog and hands the record to classification.
 *
 * <p>Every write is keyed by the repository identity, so a message redelivered after a partial
 * failure converges on the same record. Cached files are written before the relational row so
 * the row never points at content that does not exist yet.</p>
 */
@Service
public class SkillIngestionService implements PipelineJob<IngestionMessage> {
    private static final Logger log = LoggerFactory.getLogger(SkillIngestionService.class);
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    /** Column widths of {@code skills.name} and {@code skills.description}. */
    static final int MAX_NAME_CHARS = 255;
    static final int MAX_DESCRIPTION_CHARS = 2000;

    private final SkillStore skillStore;
    private final BlobStore blobStore;
    private final RepositoryMetadataClient metadataClient;
    private final MarkerFileLocator markerFileLocator;
    private final FrontmatterParser frontmatterParser;
    private final SkillFileTreeCollector fileTreeCollector;
    private final ContentHasher contentHasher;
    private final DuplicateContentGuard duplicateContentGuard;
    private final CurationNotifier curationNotifier;
    private final SlugGenerator slugGenerator;
    private final SnapshotCompressor snapshotCompressor;
    private final TrendingScoreCalculator trendingScoreCalculator;
    private final TierPolicy tierPolicy;
    private final ResurrectionService resurrectionService;
    private final WorkQueue<ClassificationMessage> classificationQueue;
    private final Clock clock;

    public SkillIngestionService(
            SkillStore skillStore,
            BlobStore blobStore,
            RepositoryMetadataClient metadataClient,
            MarkerFileLocator markerFileLocator,
            FrontmatterParser frontmatterParser,
            SkillFileTreeCollector fileTreeCollector,
            ContentHasher contentHasher,
            DuplicateContentGuard duplicateContentGuard,
            CurationNotifier curationNotifier,
            SlugGenerator slugGenerator,
            SnapshotCompressor snapshotCompressor,
            TrendingScoreCalculator trendingScoreCalculator,
            TierPolicy tierPolicy,
            ResurrectionService resurrectionService,
            WorkQueue<ClassificationMessage> classificationQueue,
            Clock clock) {
        this.skillStore = skillStore;
        this.blobStore = blobStore;
        this.metadataClient = metadataClient;
        this.markerFileLocator = markerFileLocator;
        this.frontmatterParser = frontmatterParser;
        this.fileTreeCollector = fileTreeCollector;
        this.contentHasher = contentHasher;
        this.duplicateContentGuard = duplicateContentGuard;
        this.curationNotifier = curationNotifier;
        this.slugGenerator = slugGenerator;
        this.snapshotCompressor = snapshotCompressor;
        this.trendingScoreCalculator = trendingScoreCalculator;
        this.tierPolicy = tierPolicy;
        this.resurrectionService = resurrectionService;
        this.classificationQueue = classificationQueue;
        this.clock = clock;
    }

    @Override
    public String jobName() {
        return "ingestion";
    }

    @Override
    public void execute(IngestionMessage message) {
        IngestionOutcome outcome = ingest(message);
        PIPELINE_LOG.info("[PIPELINE] {} -> {} ({})",
                message.identity().displayKey(), outcome.status(), outcome.detail());
    }

    /**
     * Runs one ingestion attempt.
     *
     * @param message repository reference
     * @return what happened; expected no-op conditions are outcomes, not exceptions
     */
    public IngestionOutcome ingest(IngestionMessage message) {
        RepositoryIdentity identity = message.identity();
        Instant now = clock.instant();

        Optional<SkillRecord> existing = skillStore.findByIdentity(identity);
        if (existing.isPresent() && existing.get().isArchived()) {
            log.info("Resubmitted archived skill {}, resurrecting", identity.displayKey());
            resurrectionService.resurrectOnResubmission(existing.get(), now);
            existing = skillStore.findByIdentity(identity);
        }

        Optional<RepositoryMetadata> fetched = metadataClient.fetchRepository(identity.owner(), identity.name());
        if (fetched.isEmpty()) {
            log.info("Repository {} not found", identity.repoKey());
            return IngestionOutcome.skipped(IngestionOutcome.Status.REPO_NOT_FOUND, identity.repoKey());
        }
        RepositoryMetadata metadata = fetched.get();
        if (metadata.fork()) {
            log.info("Skipping fork {}", identity.repoKey());
            return IngestionOutcome.skipped(IngestionOutcome.Status.FORK, identity.repoKey());
        }

        Optional<String> latestCommit = metadataClient.fetchLatestCommitSha(
                identity.owner(), identity.name(), identity.skillPath());
        if (existing.isPresent() && !message.forceReindex() && latestCommit.isPresent()
                && latestCommit.get().equals(existing.get().contentCommitSha())) {
            skillStore.updatePopularity(existing.get().id(), metadata.stars(), metadata.forks(), metadata.pushedAt(), now);
            return IngestionOutcome.of(IngestionOutcome.Status.UNCHANGED, existing.get().id(), latestCommit.get());
        }

        Optional<RepositoryFile> located = markerFileLocator.locate(identity, metadata.stars());
        if (located.isEmpty()) {
            log.info("No marker file for {}", identity.displayKey());
            return IngestionOutcome.skipped(IngestionOutcome.Status.MARKER_NOT_FOUND, identity.displayKey());
        }
        RepositoryFile marker = located.get();
        SkillFrontmatter frontmatter = frontmatterParser.parse(marker.text());

        String skillId = existing.map(SkillRecord::id).orElseGet(() -> UUID.randomUUID().toString());
        List<ContentFingerprint> fingerprints = contentHasher.fingerprints(skillId, marker.text());

        if (existing.isEmpty()) {
            DuplicateVerdict verdict = duplicateContentGuard.check(fingerprints, metadata.stars());
            switch (verdict.decision()) {
                case REJECT:
                    return IngestionOutcome.skipped(IngestionOutcome.Status.DUPLICATE_REJECTED,
                            "duplicates " + verdict.protectedOriginal().slug());
                case CONVERT_PRIVATE: {
                    SkillRecord privateOriginal = verdict.privateOriginal();
                    curationNotifier.convertAndNotify(privateOriginal, now);
                    log.info("Converted private skill {} to public for {}", privateOriginal.slug(), identity.displayKey());
                    return IngestionOutcome.of(IngestionOutcome.Status.CONVERTED_PRIVATE, privateOriginal.id(),
                            privateOriginal.slug());
                }
                case ALREADY_CONVERTED: {
                    SkillRecord converted = verdict.privateOriginal();
                    log.info("Content of {} already curated as {}", identity.displayKey(), converted.slug());
                    return IngestionOutcome.of(IngestionOutcome.Status.CONVERTED_PRIVATE, converted.id(),
                            converted.slug());
                }
                default:
                    break;
            }
        }

        List<SkillFile> files = fileTreeCollector.collect(identity, metadata, marker);
        SkillRecord skill = assemble(skillId, identity, existing, metadata, marker, frontmatter, files,
                latestCommit.orElse(null), now);

        for (SkillFile file : files) {
            if (file.isText()) {
                blobStore.putText(identity.blobPrefix() + "/" + file.relativePath(), file.text());
            }
        }
        skillStore.saveIngestedSkill(skill, fingerprints, frontmatter.declaredTags());

        classificationQueue.enqueue(new ClassificationMessage(
                skill.id(),
                identity.owner(),
                identity.name(),
                identity.blobPrefix() + "/" + MarkerFileLocator.markerFileName(marker),
                frontmatter.declaredCategories(),
                frontmatter.declaredTags(),
                metadata.stars(),
                false));

        IngestionOutcome.Status status = existing.isPresent()
                ? IngestionOutcome.Status.UPDATED
                : IngestionOutcome.Status.CREATED;
        log.info("{} {} as {} ({} files, tier {})", status, identity.displayKey(), skill.slug(), files.size(),
                skill.tier().wireValue());
        return IngestionOutcome.of(status, skill.id(), skill.slug());
    }

    private SkillRecord assemble(
            String skillId,
            RepositoryIdentity identity,
            Optional<SkillRecord> existing,
            RepositoryMetadata metadata,
            RepositoryFile marker,
            SkillFrontmatter frontmatter,
            List<SkillFile> files,
            String commitSha,
            Instant now) {
        Optional<FrontmatterParser.HeadingSummary> heading = frontmatterParser.headingSummary(marker.text());
        String name = truncate(firstNonBlank(
                frontmatter.name(),
                heading.map(FrontmatterParser.HeadingSummary::title).orElse(null),
                identity.hasSkillPath() ? lastSegment(identity.skillPath()) : identity.name()), MAX_NAME_CHARS);
        String description = truncate(firstNonBlank(
                frontmatter.description(),
                heading.map(FrontmatterParser.HeadingSummary::paragraph).orElse(null),
                metadata.description()), MAX_DESCRIPTION_CHARS);

        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        List<StarSnapshot> snapshots = snapshotCompressor.record(
                existing.map(SkillRecord::starSnapshots).orElse(List.of()), metadata.stars(), today);
        Instant lastAccessedAt = existing.map(SkillRecord::lastAccessedAt).orElse(null);
        int downloads7d = existing.map(SkillRecord::downloadCount7d).orElse(0);
        SkillTier tier = tierPolicy.assign(metadata.stars(), lastAccessedAt, now);

        SkillRecord.Builder builder = existing.map(SkillRecord::toBuilder)
                .orElseGet(() -> SkillRecord.builder()
                        .id(skillId)
                        .slug(slugGenerator.generate(identity, frontmatter.name()))
                        .identity(identity)
                        .createdAt(now));
        return builder
                .name(name)
                .description(description)
                .stars(metadata.stars())
                .forks(metadata.forks())
                .starSnapshots(snapshots)
                .trendingScore(trendingScoreCalculator.calculate(
                        metadata.stars(), snapshots, now, metadata.pushedAt(), downloads7d, now))
                .lastCommitAt(metadata.pushedAt())
                .contentHash(contentHasher.contentHash(files))
                .contentCommitSha(commitSha)
                .tier(tier)
                .nextUpdateAt(tier.nextUpdateAfter(now))
                .updatedAt(now)
                .indexedAt(now)
                .build();
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.trim();
            }
        }
        return null;
    }

    private static String truncate(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        int end = Character.isHighSurrogate(value.charAt(maxChars - 1)) ? maxChars - 1 : maxChars;
        return value.substring(0, end).stripTrailing();
    }

    private static String lastSegment(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
