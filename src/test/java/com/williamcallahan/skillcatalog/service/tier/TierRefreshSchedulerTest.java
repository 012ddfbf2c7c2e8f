package com.williamcallahan.skillcatalog.service.tier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.ClassificationMethod;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.RepositoryMetadata;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.domain.SkillRefresh;
import com.williamcallahan.skillcatalog.domain.SkillTier;
import com.williamcallahan.skillcatalog.domain.StarSnapshot;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationMessage;
import com.williamcallahan.skillcatalog.queue.WorkQueue;
import com.williamcallahan.skillcatalog.service.github.GitHubApiException;
import com.williamcallahan.skillcatalog.service.github.RepositoryMetadataClient;
import com.williamcallahan.skillcatalog.service.metrics.PipelineMetrics;
import com.williamcallahan.skillcatalog.service.trending.SnapshotCompressor;
import com.williamcallahan.skillcatalog.service.trending.TrendingScoreCalculator;
import com.williamcallahan.skillcatalog.store.CaffeineFlagStore;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

/**
 * Verifies group ordering, flag consumption, stale fallback and reclassification hand-off.
 */
class TierRefreshSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-05-10T12:00:00Z");

    private SkillStore skillStore;
    private CaffeineFlagStore flagStore;
    private RepositoryMetadataClient metadataClient;
    private WorkQueue<ClassificationMessage> classificationQueue;
    private PipelineMetrics pipelineMetrics;
    private AppProperties appProperties;
    private TierRefreshScheduler scheduler;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        skillStore = Mockito.mock(SkillStore.class);
        flagStore = new CaffeineFlagStore();
        metadataClient = Mockito.mock(RepositoryMetadataClient.class);
        classificationQueue = Mockito.mock(WorkQueue.class);
        pipelineMetrics = Mockito.mock(PipelineMetrics.class);
        appProperties = new AppProperties();
        scheduler = new TierRefreshScheduler(
                skillStore,
                flagStore,
                metadataClient,
                new TrendingScoreCalculator(),
                new SnapshotCompressor(),
                new TierPolicy(),
                new ReclassificationDetector(skillStore, classificationQueue, appProperties),
                appProperties,
                pipelineMetrics);
    }

    @Test
    void flaggedRecordsRunFirstAndAreNotRefreshedTwice() {
        SkillRecord flagged = record("f1", "flagged", 50, SkillTier.COOL, ClassificationMethod.KEYWORD);
        SkillRecord hot = record("h1", "hot", 1500, SkillTier.HOT, ClassificationMethod.AI);
        flagStore.put(TierRefreshScheduler.NEEDS_UPDATE_PREFIX + "f1", "1", Duration.ofHours(1));
        when(skillStore.findByIds(List.of("f1"))).thenReturn(List.of(flagged));
        when(skillStore.findDueByTier(SkillTier.HOT, NOW, 500)).thenReturn(List.of(flagged, hot));
        when(skillStore.findTags("f1")).thenReturn(List.of("notes"));
        when(metadataClient.fetchRepositories(List.of(flagged.identity())))
                .thenReturn(Map.of("acme/flagged", metadata(120)));
        when(metadataClient.fetchRepositories(List.of(hot.identity())))
                .thenReturn(Map.of("acme/hot", metadata(1600)));

        TierRefreshScheduler.RefreshReport report = scheduler.refresh(NOW);

        assertEquals(new TierRefreshScheduler.RefreshReport(1, 1, 0, 0, 0, 1), report);
        assertTrue(flagStore.listKeys(TierRefreshScheduler.NEEDS_UPDATE_PREFIX, 10).isEmpty());

        ArgumentCaptor<List<SkillRefresh>> written = refreshCaptor();
        verify(skillStore, times(2)).applyRefreshes(written.capture());
        SkillRefresh flaggedRefresh = written.getAllValues().get(0).get(0);
        assertEquals("f1", flaggedRefresh.skillId());
        assertEquals(120, flaggedRefresh.stars());
        assertEquals(SkillTier.WARM, flaggedRefresh.tier());
        assertEquals(NOW.plus(Duration.ofHours(24)), flaggedRefresh.nextUpdateAt());
        assertEquals(List.of(new StarSnapshot("2025-05-10", 120)), flaggedRefresh.starSnapshots());
        assertEquals(List.of("h1"), written.getAllValues().get(1).stream().map(SkillRefresh::skillId).toList());

        ArgumentCaptor<ClassificationMessage> queued = ArgumentCaptor.forClass(ClassificationMessage.class);
        verify(classificationQueue).enqueue(queued.capture());
        assertEquals("f1", queued.getValue().skillId());
        assertEquals("skills/acme/flagged/SKILL.md", queued.getValue().skillMdPath());
        assertEquals(120, queued.getValue().stars());
        assertTrue(queued.getValue().reclassification());
    }

    @Test
    void failedMetadataBatchRescoresFromStoredValues() {
        SkillRecord warm = record("w1", "warm", 150, SkillTier.WARM, ClassificationMethod.AI);
        when(skillStore.findDueByTier(SkillTier.WARM, NOW, 500)).thenReturn(List.of(warm));
        when(metadataClient.fetchRepositories(anyList())).thenThrow(new GitHubApiException("rate limited", 429));

        TierRefreshScheduler.RefreshReport report = scheduler.refresh(NOW);

        assertEquals(1, report.warm());
        assertEquals(1, report.stale());
        ArgumentCaptor<List<SkillRefresh>> written = refreshCaptor();
        verify(skillStore).applyRefreshes(written.capture());
        SkillRefresh refresh = written.getValue().get(0);
        assertEquals(150, refresh.stars());
        assertEquals(warm.starSnapshots(), refresh.starSnapshots());
        assertEquals(SkillTier.WARM, refresh.tier());
        verify(classificationQueue, never()).enqueue(any());
    }

    @Test
    void groupsAreSplitIntoMetadataBatches() {
        appProperties.getGithub().setGraphqlBatchSize(2);
        List<SkillRecord> due = List.of(
                record("c1", "one", 20, SkillTier.COOL, ClassificationMethod.KEYWORD),
                record("c2", "two", 20, SkillTier.COOL, ClassificationMethod.KEYWORD),
                record("c3", "three", 20, SkillTier.COOL, ClassificationMethod.KEYWORD));
        when(skillStore.findDueByTier(SkillTier.COOL, NOW, 125)).thenReturn(due);
        when(metadataClient.fetchRepositories(anyList())).thenReturn(Map.of());

        TierRefreshScheduler.RefreshReport report = scheduler.refresh(NOW);

        assertEquals(3, report.cool());
        assertEquals(3, report.total());
        verify(metadataClient, times(2)).fetchRepositories(anyList());
        verify(skillStore, times(2)).applyRefreshes(anyList());
    }

    @Test
    void archivedFlaggedRecordsAreDroppedButTheirFlagsCleared() {
        SkillRecord archived = record("a1", "gone", 1, SkillTier.ARCHIVED, null);
        flagStore.put(TierRefreshScheduler.NEEDS_UPDATE_PREFIX + "a1", "1", Duration.ofHours(1));
        when(skillStore.findByIds(List.of("a1"))).thenReturn(List.of(archived));

        TierRefreshScheduler.RefreshReport report = scheduler.refresh(NOW);

        assertEquals(0, report.total());
        assertTrue(flagStore.get(TierRefreshScheduler.NEEDS_UPDATE_PREFIX + "a1").isEmpty());
        verify(skillStore, never()).applyRefreshes(anyList());
        verify(metadataClient, never()).fetchRepositories(anyList());
    }

    @Test
    void unpopularUnvisitedRecordDropsToColdWithoutSchedule() {
        SkillRecord quiet = record("q1", "quiet", 20, SkillTier.COOL, ClassificationMethod.KEYWORD);

        SkillRefresh refresh = scheduler.recompute(quiet, metadata(3), NOW);

        assertEquals(SkillTier.COLD, refresh.tier());
        assertNull(refresh.nextUpdateAt());
        assertEquals(3, refresh.stars());
    }

    @SuppressWarnings("unchecked")
    private static ArgumentCaptor<List<SkillRefresh>> refreshCaptor() {
        return ArgumentCaptor.forClass((Class<List<SkillRefresh>>) (Class<?>) List.class);
    }

    private static RepositoryMetadata metadata(int stars) {
        return new RepositoryMetadata(stars, 1, false, NOW.minus(Duration.ofDays(3)), null, List.of(), "main");
    }

    private static SkillRecord record(String id, String repoName, int stars, SkillTier tier, ClassificationMethod method) {
        Instant indexed = NOW.minus(Duration.ofDays(40));
        return SkillRecord.builder()
                .id(id)
                .slug("acme-" + repoName)
                .identity(RepositoryIdentity.of("acme", repoName))
                .name(repoName)
                .stars(stars)
                .tier(tier)
                .classificationMethod(method)
                .lastCommitAt(NOW.minus(Duration.ofDays(10)))
                .nextUpdateAt(NOW.minus(Duration.ofMinutes(5)))
                .createdAt(indexed)
                .updatedAt(indexed)
                .indexedAt(indexed)
                .build();
    }
}
