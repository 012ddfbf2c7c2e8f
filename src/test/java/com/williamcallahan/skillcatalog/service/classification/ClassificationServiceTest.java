package com.williamcallahan.skillcatalog.service.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.ClassificationMethod;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.domain.SkillTier;
import com.williamcallahan.skillcatalog.domain.classification.CategorySuggestion;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationMessage;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationResult;
import com.williamcallahan.skillcatalog.service.metrics.PipelineMetrics;
import com.williamcallahan.skillcatalog.store.BlobStore;
import com.williamcallahan.skillcatalog.store.CaffeineFlagStore;
import com.williamcallahan.skillcatalog.store.SkillStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

/**
 * Verifies method selection, the keyword fallback, suggestion linking and run counters.
 */
class ClassificationServiceTest {

    private static final Instant NOW = Instant.parse("2025-05-10T12:30:00Z");
    private static final String MARKER_KEY = "skills/acme/flow/SKILL.md";
    private static final String MARKER_CONTENT = "# Flow\nHelps you commit, rebase and merge with git.\n";

    private SkillStore skillStore;
    private BlobStore blobStore;
    private AiClassificationChain aiClassificationChain;
    private PipelineMetrics pipelineMetrics;
    private ClassificationService classificationService;

    @BeforeEach
    void setUp() {
        skillStore = Mockito.mock(SkillStore.class);
        blobStore = Mockito.mock(BlobStore.class);
        aiClassificationChain = Mockito.mock(AiClassificationChain.class);
        pipelineMetrics = new PipelineMetrics(new CaffeineFlagStore(), new ObjectMapper(), new SimpleMeterRegistry());
        classificationService = new ClassificationService(
                skillStore,
                blobStore,
                new ClassificationAdmissionPolicy(new AppProperties()),
                new KeywordClassifier(),
                aiClassificationChain,
                pipelineMetrics,
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(skillStore.findById("s1")).thenReturn(Optional.of(popularSkill()));
        when(skillStore.findCustomCategories()).thenReturn(List.of());
    }

    @Test
    void exhaustedAiChainFallsBackToKeywords() {
        when(blobStore.getText(MARKER_KEY)).thenReturn(Optional.of(MARKER_CONTENT));
        when(aiClassificationChain.classify(anyString(), anyList(), any())).thenReturn(Optional.empty());

        assertEquals(Optional.of(ClassificationMethod.KEYWORD), classificationService.classify(message()));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> categories = ArgumentCaptor.forClass(List.class);
        verify(skillStore).replaceCategories(eq("s1"), categories.capture(),
                eq(KeywordClassifier.MATCH_CONFIDENCE), eq(ClassificationMethod.KEYWORD), isNull(), eq(NOW));
        assertEquals("git", categories.getValue().get(0));
    }

    @Test
    void suggestedCategoryTravelsWithItsLink() {
        CategorySuggestion suggestion = new CategorySuggestion("music-production", "Music Production", "Audio work");
        when(blobStore.getText(MARKER_KEY)).thenReturn(Optional.of(MARKER_CONTENT));
        when(aiClassificationChain.classify(anyString(), anyList(), any())).thenReturn(Optional.of(
                new ClassificationResult(List.of("music-production"), 0.7, "audio", suggestion)));

        assertEquals(Optional.of(ClassificationMethod.AI), classificationService.classify(message()));

        verify(skillStore).replaceCategories(
                "s1", List.of("music-production"), 0.7, ClassificationMethod.AI, suggestion, NOW);
    }

    @Test
    void missingMarkerContentLeavesRecordUnclassified() {
        when(blobStore.getText(anyString())).thenReturn(Optional.empty());

        assertTrue(classificationService.classify(message()).isEmpty());

        verify(blobStore).getText("skills/acme/flow/skill.md");
        verify(aiClassificationChain, never()).classify(anyString(), anyList(), any());
        verify(skillStore, never()).replaceCategories(
                anyString(), anyList(), anyDouble(), any(), any(), any());
        assertTrue(pipelineMetrics.read(ClassificationService.METRICS_STAGE, PipelineMetrics.hourly(NOW)).isEmpty());
    }

    @Test
    void blankMarkerContentLeavesRecordUnclassified() {
        when(blobStore.getText(MARKER_KEY)).thenReturn(Optional.of(" \n"));
        when(blobStore.getText("skills/acme/flow/skill.md")).thenReturn(Optional.of(""));

        assertTrue(classificationService.classify(message()).isEmpty());

        verify(aiClassificationChain, never()).classify(anyString(), anyList(), any());
        verify(skillStore, never()).replaceCategories(
                anyString(), anyList(), anyDouble(), any(), any(), any());
        assertTrue(pipelineMetrics.read(ClassificationService.METRICS_STAGE, PipelineMetrics.hourly(NOW)).isEmpty());
    }

    @Test
    void lowercaseMarkerIsReadWhenCanonicalNameIsAbsent() {
        when(blobStore.getText(MARKER_KEY)).thenReturn(Optional.empty());
        when(blobStore.getText("skills/acme/flow/skill.md")).thenReturn(Optional.of(MARKER_CONTENT));
        when(aiClassificationChain.classify(eq(MARKER_CONTENT), eq(List.of("git")), any()))
                .thenReturn(Optional.of(ClassificationResult.of(List.of("git"), 0.9, "vcs")));

        assertEquals(Optional.of(ClassificationMethod.AI), classificationService.classify(message()));
    }

    @Test
    void eachRunIsCountedByMethodInTheHourlyBucket() {
        when(blobStore.getText(MARKER_KEY)).thenReturn(Optional.of(MARKER_CONTENT));
        when(aiClassificationChain.classify(anyString(), anyList(), any()))
                .thenReturn(Optional.of(ClassificationResult.of(List.of("git"), 0.9, "vcs")))
                .thenReturn(Optional.empty());

        classificationService.classify(message());
        classificationService.classify(message());

        Map<String, Long> counters = pipelineMetrics
                .read(ClassificationService.METRICS_STAGE, PipelineMetrics.hourly(NOW))
                .orElseThrow();
        assertEquals(Long.valueOf(1), counters.get("ai"));
        assertEquals(Long.valueOf(1), counters.get("keyword"));
        assertEquals(Long.valueOf(2), counters.get("total"));
    }

    private static ClassificationMessage message() {
        return new ClassificationMessage("s1", "acme", "flow", MARKER_KEY, List.of(), List.of("git"), null, false);
    }

    private static SkillRecord popularSkill() {
        return SkillRecord.builder()
                .id("s1")
                .slug("acme-flow")
                .identity(RepositoryIdentity.of("acme", "flow"))
                .name("Flow")
                .stars(500)
                .tier(SkillTier.WARM)
                .createdAt(NOW)
                .updatedAt(NOW)
                .indexedAt(NOW)
                .build();
    }
}
