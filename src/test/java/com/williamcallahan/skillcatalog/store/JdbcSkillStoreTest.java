package com.williamcallahan.skillcatalog.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.skillcatalog.domain.ClassificationMethod;
import com.williamcallahan.skillcatalog.domain.ContentFingerprint;
import com.williamcallahan.skillcatalog.domain.DuplicateCandidate;
import com.williamcallahan.skillcatalog.domain.HashType;
import com.williamcallahan.skillcatalog.domain.ListingEntry;
import com.williamcallahan.skillcatalog.domain.ListingKind;
import com.williamcallahan.skillcatalog.domain.Notification;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.domain.SkillRefresh;
import com.williamcallahan.skillcatalog.domain.SkillTier;
import com.williamcallahan.skillcatalog.domain.StarSnapshot;
import com.williamcallahan.skillcatalog.domain.Visibility;
import com.williamcallahan.skillcatalog.domain.classification.CategoryDefinition;
import com.williamcallahan.skillcatalog.domain.classification.CategorySuggestion;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Verifies the JDBC store against an embedded H2 database built from the production schema.
 */
class JdbcSkillStoreTest {

    private static final Instant NOW = Instant.parse("2025-05-10T12:00:00Z");

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private JdbcSkillStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(database);
        TransactionTemplate transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(database));
        store = new JdbcSkillStore(jdbcTemplate, transactionTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void savedSkillIsReadBackByIdentity() {
        SkillRecord skill = skill("s1", "notes", 42, SkillTier.COOL).toBuilder()
                .starSnapshots(List.of(new StarSnapshot("2025-05-01", 40), new StarSnapshot("2025-05-10", 42)))
                .build();

        store.saveIngestedSkill(skill, fingerprints("s1", "full-1", "norm-1"), List.of("notes", "notes", "writing"));

        SkillRecord loaded = store.findByIdentity(RepositoryIdentity.of("Acme", "Notes")).orElseThrow();
        assertEquals("acme-notes", loaded.slug());
        assertEquals(42, loaded.stars());
        assertEquals(SkillTier.COOL, loaded.tier());
        assertEquals(skill.starSnapshots(), loaded.starSnapshots());
        assertEquals(skill.nextUpdateAt(), loaded.nextUpdateAt());
        assertNull(loaded.lastAccessedAt());
        assertEquals(List.of("notes", "writing"), store.findTags("s1"));
        assertTrue(store.slugExists("acme-notes"));
    }

    @Test
    void reingestionUpdatesInPlaceAndKeepsSlug() {
        store.saveIngestedSkill(skill("s1", "notes", 42, SkillTier.COOL), fingerprints("s1", "full-1", "norm-1"), List.of("notes"));
        SkillRecord changed = skill("s1", "notes", 55, SkillTier.COOL).toBuilder()
                .slug("ignored-on-update")
                .contentCommitSha("commit-2")
                .build();

        store.saveIngestedSkill(changed, fingerprints("s1", "full-2", "norm-2"), List.of("notes", "extra"));

        SkillRecord loaded = store.findById("s1").orElseThrow();
        assertEquals("acme-notes", loaded.slug());
        assertEquals(55, loaded.stars());
        assertEquals("commit-2", loaded.contentCommitSha());
        assertEquals(List.of("extra", "notes"), store.findTags("s1"));
        Integer hashes = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM content_hashes WHERE skill_id = 's1'", Integer.class);
        assertEquals(2, hashes);
    }

    @Test
    void publicDuplicateLookupHonorsStarFloorAndExclusion() {
        store.saveIngestedSkill(skill("big", "big", 2000, SkillTier.HOT), fingerprints("big", "full-a", "shared"), List.of());
        store.saveIngestedSkill(skill("small", "small", 50, SkillTier.COOL), fingerprints("small", "full-b", "shared"), List.of());

        assertEquals(new DuplicateCandidate("big", "acme-big", 2000), store.findPublicDuplicate("shared", 1000, null).orElseThrow());
        assertTrue(store.findPublicDuplicate("shared", 1000, "big").isEmpty());
        assertTrue(store.findPublicDuplicate("other", 0, null).isEmpty());
    }

    @Test
    void privateSkillIsConvertedWithItsNotificationAndStaysMatchable() {
        SkillRecord privateSkill = skill("p1", "private", 0, SkillTier.COLD).toBuilder()
                .visibility(Visibility.PRIVATE)
                .ownerUserId("user-1")
                .build();
        store.saveIngestedSkill(privateSkill, fingerprints("p1", "full-p", "norm-p"), List.of());

        assertEquals("p1", store.findCurationMatchByFullHash("full-p").orElseThrow().id());
        assertTrue(store.convertToPublic("p1",
                new Notification("n1", "user-1", "p1", "skill_curated", "Curated", "Now public", NOW), NOW));
        assertFalse(store.convertToPublic("p1",
                new Notification("n2", "user-1", "p1", "skill_curated", "Curated", "Again", NOW), NOW));

        SkillRecord converted = store.findCurationMatchByFullHash("full-p").orElseThrow();
        assertEquals("p1", converted.id());
        assertEquals(Visibility.PUBLIC, converted.visibility());
        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM notifications", Integer.class));
    }

    @Test
    void publicSkillThatWasNeverPrivateIsNoCurationMatch() {
        store.saveIngestedSkill(skill("pub", "pub", 5, SkillTier.COLD), fingerprints("pub", "full-q", "norm-q"), List.of());

        assertTrue(store.findCurationMatchByFullHash("full-q").isEmpty());
    }

    @Test
    void notificationIsStoredOnce() {
        Notification notification = new Notification("n1", "user-1", "p1", "skill_curated", "Curated", "Now public", NOW);

        assertTrue(store.insertNotificationIfAbsent(notification));
        assertFalse(store.insertNotificationIfAbsent(
                new Notification("n2", "user-1", "p1", "skill_curated", "Curated", "Again", NOW)));
    }

    @Test
    void categoriesAreReplacedWithMethod() {
        store.saveIngestedSkill(skill("s1", "notes", 42, SkillTier.COOL), List.of(), List.of());
        store.replaceCategories(
                "s1", List.of("testing", "productivity"), 0.5, ClassificationMethod.KEYWORD, null, NOW);
        store.replaceCategories(
                "s1", List.of("productivity", "productivity"), 1.0, ClassificationMethod.DIRECT, null, NOW);

        assertEquals(List.of("productivity"), store.findCategorySlugs("s1"));
        assertEquals(ClassificationMethod.DIRECT, store.findById("s1").orElseThrow().classificationMethod());
    }

    @Test
    void suggestedCategoryIsStoredOnlyWhenLinked() {
        CategorySuggestion music = new CategorySuggestion("music-production", "Music Production", "Audio work");
        store.saveIngestedSkill(skill("s1", "notes", 42, SkillTier.COOL), List.of(), List.of());
        store.saveIngestedSkill(skill("s2", "beats", 42, SkillTier.COOL), List.of(), List.of());

        store.replaceCategories("s1", List.of("productivity"), 0.8, ClassificationMethod.AI, music, NOW);
        assertTrue(store.findCustomCategories().isEmpty());

        store.replaceCategories("s1", List.of("music-production"), 0.8, ClassificationMethod.AI, music, NOW);
        store.replaceCategories("s2", List.of("music-production"), 0.8, ClassificationMethod.AI, music, NOW);

        assertEquals(List.of("music-production"), store.findCategorySlugs("s1"));
        assertEquals(List.of("music-production"),
                store.findCustomCategories().stream().map(CategoryDefinition::slug).collect(Collectors.toList()));
        assertEquals(2, jdbcTemplate.queryForObject(
                "SELECT usage_count FROM categories WHERE slug = 'music-production'", Integer.class));
        assertEquals("s1", jdbcTemplate.queryForObject(
                "SELECT suggested_by_skill_id FROM categories WHERE slug = 'music-production'", String.class));
    }

    @Test
    void dueSelectionAndRefreshSkipArchivedRows() {
        store.saveIngestedSkill(skill("h1", "due", 1500, SkillTier.HOT).toBuilder()
                .nextUpdateAt(NOW.minus(Duration.ofMinutes(1))).build(), List.of(), List.of());
        store.saveIngestedSkill(skill("h2", "later", 1500, SkillTier.HOT).toBuilder()
                .nextUpdateAt(NOW.plus(Duration.ofHours(1))).build(), List.of(), List.of());
        store.saveIngestedSkill(skill("a1", "gone", 1, SkillTier.ARCHIVED), List.of(), List.of());

        assertEquals(List.of("h1"), ids(store.findDueByTier(SkillTier.HOT, NOW, 10)));

        store.applyRefreshes(List.of(
                new SkillRefresh("h1", 1600, 3, List.of(), null, 12.5, SkillTier.HOT, NOW.plus(Duration.ofHours(6)), NOW),
                new SkillRefresh("a1", 900, 0, List.of(), null, 1.0, SkillTier.WARM, NOW.plus(Duration.ofHours(24)), NOW)));

        SkillRecord refreshed = store.findById("h1").orElseThrow();
        assertEquals(1600, refreshed.stars());
        assertEquals(12.5, refreshed.trendingScore());
        assertEquals(NOW.plus(Duration.ofHours(6)), refreshed.nextUpdateAt());
        assertEquals(SkillTier.ARCHIVED, store.findById("a1").orElseThrow().tier());
    }

    @Test
    void downloadEventsRollIntoCountersAndArePruned() {
        store.saveIngestedSkill(skill("s1", "notes", 42, SkillTier.COOL), List.of(), List.of());
        store.recordDownload("s1", NOW.minus(Duration.ofDays(1)));
        store.recordDownload("s1", NOW.minus(Duration.ofDays(10)));
        store.recordDownload("s1", NOW.minus(Duration.ofDays(40)));

        store.refreshDownloadCounts(NOW);
        SkillRecord counted = store.findById("s1").orElseThrow();
        assertEquals(1, counted.downloadCount7d());
        assertEquals(2, counted.downloadCount30d());

        assertEquals(1, store.pruneDownloadEvents(NOW.minus(Duration.ofDays(35))));
    }

    @Test
    void staleAccessCountersAreReset() {
        store.saveIngestedSkill(skill("s1", "notes", 42, SkillTier.COOL), List.of(), List.of());
        store.recordAccess("s1", NOW.minus(Duration.ofDays(10)));
        store.recordAccess("s1", NOW.minus(Duration.ofDays(10)));

        assertEquals(1, store.resetStaleAccessCounts(NOW));

        SkillRecord reset = store.findById("s1").orElseThrow();
        assertEquals(0, reset.accessCount7d());
        assertEquals(2, reset.accessCount30d());
    }

    @Test
    void archiveAndResurrectionRoundTrip() {
        SkillRecord stale = skill("s1", "notes", 2, SkillTier.COLD).toBuilder()
                .lastCommitAt(NOW.minus(Duration.ofDays(800)))
                .createdAt(NOW.minus(Duration.ofDays(900)))
                .build();
        store.saveIngestedSkill(stale, List.of(), List.of());
        store.saveIngestedSkill(skill("s2", "popular", 40, SkillTier.COOL), List.of(), List.of());
        store.replaceCategories("s1", List.of("productivity"), 0.5, ClassificationMethod.KEYWORD, null, NOW);

        List<SkillRecord> candidates = store.findArchiveCandidates(
                NOW.minus(Duration.ofDays(365)), 5, NOW.minus(Duration.ofDays(730)), 10);
        assertEquals(List.of("s1"), ids(candidates));

        store.markArchived("s1", NOW);
        assertEquals(SkillTier.ARCHIVED, store.findById("s1").orElseThrow().tier());
        assertTrue(store.findCategorySlugs("s1").isEmpty());
        assertEquals(List.of("s1"), ids(store.findArchived(null, 10)));
        assertTrue(store.findArchived("s1", 10).isEmpty());

        store.markResurrected("s1", List.of("productivity"), List.of(new StarSnapshot("2025-01-01", 2)), NOW);
        SkillRecord restored = store.findById("s1").orElseThrow();
        assertEquals(SkillTier.COLD, restored.tier());
        assertNull(restored.nextUpdateAt());
        assertEquals(NOW, restored.lastAccessedAt());
        assertEquals(List.of("productivity"), store.findCategorySlugs("s1"));
    }

    @Test
    void listingsExcludeArchivedAndPrivateRecords() {
        store.saveIngestedSkill(skill("s1", "one", 10, SkillTier.COOL).toBuilder().trendingScore(5).build(), List.of(), List.of());
        store.saveIngestedSkill(skill("s2", "two", 500, SkillTier.WARM).toBuilder().trendingScore(1).build(), List.of(), List.of());
        store.saveIngestedSkill(skill("s3", "three", 900, SkillTier.ARCHIVED), List.of(), List.of());
        store.saveIngestedSkill(skill("s4", "four", 900, SkillTier.COOL).toBuilder()
                .visibility(Visibility.PRIVATE).build(), List.of(), List.of());

        List<ListingEntry> trending = store.findListing(ListingKind.TRENDING, 10);
        List<ListingEntry> top = store.findListing(ListingKind.TOP, 1);

        assertEquals(List.of("s1", "s2"), trending.stream().map(ListingEntry::id).collect(Collectors.toList()));
        assertEquals(List.of("s2"), top.stream().map(ListingEntry::id).collect(Collectors.toList()));
    }

    private static List<String> ids(List<SkillRecord> records) {
        return records.stream().map(SkillRecord::id).collect(Collectors.toList());
    }

    private static List<ContentFingerprint> fingerprints(String skillId, String full, String normalized) {
        return List.of(
                new ContentFingerprint(skillId, HashType.FULL, full),
                new ContentFingerprint(skillId, HashType.NORMALIZED, normalized));
    }

    private static SkillRecord skill(String id, String repoName, int stars, SkillTier tier) {
        Instant created = NOW.minus(Duration.ofDays(30));
        return SkillRecord.builder()
                .id(id)
                .slug("acme-" + repoName)
                .identity(RepositoryIdentity.of("acme", repoName))
                .name(repoName)
                .stars(stars)
                .tier(tier)
                .nextUpdateAt(tier.nextUpdateAfter(NOW))
                .contentCommitSha("commit-1")
                .createdAt(created)
                .updatedAt(created)
                .indexedAt(created)
                .build();
    }
}
