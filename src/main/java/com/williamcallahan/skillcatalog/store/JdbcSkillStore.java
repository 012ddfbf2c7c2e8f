package com.williamcallahan.skillcatalog.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.Lists;
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
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link SkillStore} on Spring's {@link JdbcTemplate}.
 *
 * <p>Upserts are written as update-then-insert inside one transaction so the same SQL runs on
 * PostgreSQL and H2. A concurrent insert of the same natural key surfaces as a
 * {@link SkillStoreException} and the caller's retry converges on the row the other writer
 * created. Times are stored as epoch milliseconds.</p>
 */
@Repository
public class JdbcSkillStore implements SkillStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcSkillStore.class);

    private static final String SKILL_COLUMNS = "id, slug, repo_owner, repo_name, skill_path, name, description, "
            + "stars, forks, star_snapshots, trending_score, last_commit_at, content_hash, content_commit_sha, "
            + "tier, last_accessed_at, access_count_7d, access_count_30d, download_count_7d, download_count_30d, "
            + "next_update_at, classification_method, visibility, owner_user_id, created_at, updated_at, indexed_at";
    private static final String SELECT_SKILLS = "SELECT " + SKILL_COLUMNS + " FROM skills ";
    private static final int IN_CLAUSE_CHUNK = 100;
    private static final int MAX_TAG_LENGTH = 100;
    private static final int MAX_TAGS = 20;
    private static final TypeReference<List<StarSnapshot>> SNAPSHOT_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<SkillRecord> skillRowMapper = this::mapSkill;

    public JdbcSkillStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<SkillRecord> findById(String skillId) {
        return inStore("findById", () -> jdbcTemplate.query(SELECT_SKILLS + "WHERE id = ?", skillRowMapper, skillId)
                .stream().findFirst());
    }

    @Override
    public Optional<SkillRecord> findByIdentity(RepositoryIdentity identity) {
        return inStore("findByIdentity", () -> jdbcTemplate.query(
                        SELECT_SKILLS + "WHERE repo_owner = ? AND repo_name = ? AND skill_path = ?",
                        skillRowMapper, identity.owner(), identity.name(), identity.skillPath())
                .stream().findFirst());
    }

    @Override
    public List<SkillRecord> findByIds(Collection<String> skillIds) {
        if (skillIds.isEmpty()) {
            return List.of();
        }
        return inStore("findByIds", () -> {
            List<SkillRecord> found = new ArrayList<>();
            for (List<String> chunk : Lists.partition(List.copyOf(skillIds), IN_CLAUSE_CHUNK)) {
                String placeholders = String.join(", ", Collections.nCopies(chunk.size(), "?"));
                found.addAll(jdbcTemplate.query(
                        SELECT_SKILLS + "WHERE id IN (" + placeholders + ") ORDER BY id", skillRowMapper, chunk.toArray()));
            }
            return found;
        });
    }

    @Override
    public boolean slugExists(String slug) {
        return inStore("slugExists", () -> {
            Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM skills WHERE slug = ?", Integer.class, slug);
            return count != null && count > 0;
        });
    }

    @Override
    public void saveIngestedSkill(SkillRecord skill, List<ContentFingerprint> fingerprints, Collection<String> tags) {
        inStore("saveIngestedSkill", () -> transactionTemplate.execute(status -> {
            upsertSkill(skill);
            for (ContentFingerprint fingerprint : fingerprints) {
                upsertFingerprint(fingerprint, skill.updatedAt());
            }
            insertMissingTags(skill.id(), tags);
            return null;
        }));
    }

    private void upsertSkill(SkillRecord skill) {
        String snapshots = writeSnapshots(skill.starSnapshots());
        int updated = jdbcTemplate.update(
                "UPDATE skills SET name = ?, description = ?, stars = ?, forks = ?, star_snapshots = ?, "
                        + "trending_score = ?, last_commit_at = ?, content_hash = ?, content_commit_sha = ?, tier = ?, "
                        + "next_update_at = ?, visibility = ?, updated_at = ?, indexed_at = ? WHERE id = ?",
                skill.name(), skill.description(), skill.stars(), skill.forks(), snapshots,
                skill.trendingScore(), millis(skill.lastCommitAt()), skill.contentHash(), skill.contentCommitSha(),
                skill.tier().wireValue(), millis(skill.nextUpdateAt()), skill.visibility().wireValue(),
                millis(skill.updatedAt()), millis(skill.indexedAt()), skill.id());
        if (updated > 0) {
            return;
        }
        RepositoryIdentity identity = skill.identity();
        jdbcTemplate.update(
                "INSERT INTO skills (" + SKILL_COLUMNS + ") VALUES "
                        + "(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                skill.id(), skill.slug(), identity.owner(), identity.name(), identity.skillPath(),
                skill.name(), skill.description(), skill.stars(), skill.forks(), snapshots,
                skill.trendingScore(), millis(skill.lastCommitAt()), skill.contentHash(), skill.contentCommitSha(),
                skill.tier().wireValue(), millis(skill.lastAccessedAt()), skill.accessCount7d(), skill.accessCount30d(),
                skill.downloadCount7d(), skill.downloadCount30d(), millis(skill.nextUpdateAt()),
                skill.classificationMethod() == null ? null : skill.classificationMethod().wireValue(),
                skill.visibility().wireValue(), skill.ownerUserId(), millis(skill.createdAt()),
                millis(skill.updatedAt()), millis(skill.indexedAt()));
    }

    private void upsertFingerprint(ContentFingerprint fingerprint, Instant now) {
        int updated = jdbcTemplate.update(
                "UPDATE content_hashes SET hash_value = ?, created_at = ? WHERE skill_id = ? AND hash_type = ?",
                fingerprint.hashValue(), millis(now), fingerprint.skillId(), fingerprint.hashType().wireValue());
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO content_hashes (skill_id, hash_type, hash_value, created_at) VALUES (?, ?, ?, ?)",
                    fingerprint.skillId(), fingerprint.hashType().wireValue(), fingerprint.hashValue(), millis(now));
        }
    }

    private void insertMissingTags(String skillId, Collection<String> tags) {
        Set<String> existing = new HashSet<>(findTags(skillId));
        tags.stream()
                .filter(tag -> tag != null && !tag.isBlank() && tag.length() <= MAX_TAG_LENGTH)
                .distinct()
                .filter(tag -> !existing.contains(tag))
                .limit(MAX_TAGS)
                .forEach(tag -> jdbcTemplate.update(
                        "INSERT INTO skill_tags (skill_id, tag) VALUES (?, ?)", skillId, tag));
    }

    @Override
    public void updatePopularity(String skillId, int stars, int forks, Instant lastCommitAt, Instant now) {
        inStore("updatePopularity", () -> jdbcTemplate.update(
                "UPDATE skills SET stars = ?, forks = ?, last_commit_at = ?, updated_at = ? WHERE id = ?",
                stars, forks, millis(lastCommitAt), millis(now), skillId));
    }

    @Override
    public Optional<DuplicateCandidate> findPublicDuplicate(String normalizedHash, int minStars, String excludeSkillId) {
        return inStore("findPublicDuplicate", () -> jdbcTemplate.query(
                        "SELECT s.id, s.slug, s.stars FROM content_hashes h JOIN skills s ON s.id = h.skill_id "
                                + "WHERE h.hash_type = ? AND h.hash_value = ? AND s.visibility = ? "
                                + "AND s.stars >= ? AND s.id <> ? ORDER BY s.stars DESC, s.id LIMIT 1",
                        (rs, rowNum) -> new DuplicateCandidate(rs.getString("id"), rs.getString("slug"), rs.getInt("stars")),
                        HashType.NORMALIZED.wireValue(), normalizedHash, Visibility.PUBLIC.wireValue(), minStars,
                        excludeSkillId == null ? "" : excludeSkillId)
                .stream().findFirst());
    }

    @Override
    public Optional<SkillRecord> findCurationMatchByFullHash(String fullHash) {
        return inStore("findCurationMatchByFullHash", () -> jdbcTemplate.query(
                        SELECT_SKILLS + "WHERE (visibility = ? OR curated_at IS NOT NULL) AND id IN "
                                + "(SELECT skill_id FROM content_hashes WHERE hash_type = ? AND hash_value = ?) "
                                + "ORDER BY created_at, id LIMIT 1",
                        skillRowMapper, Visibility.PRIVATE.wireValue(), HashType.FULL.wireValue(), fullHash)
                .stream().findFirst());
    }

    @Override
    public boolean convertToPublic(String skillId, Notification notification, Instant now) {
        Boolean notified = inStore("convertToPublic", () -> transactionTemplate.execute(status -> {
            jdbcTemplate.update(
                    "UPDATE skills SET visibility = ?, curated_at = ?, updated_at = ? WHERE id = ?",
                    Visibility.PUBLIC.wireValue(), millis(now), millis(now), skillId);
            return notification != null && !notificationExists(notification) && insertNotification(notification);
        }));
        return Boolean.TRUE.equals(notified);
    }

    @Override
    public boolean insertNotificationIfAbsent(Notification notification) {
        return inStore("insertNotificationIfAbsent", () -> {
            if (notificationExists(notification)) {
                return false;
            }
            try {
                return insertNotification(notification);
            } catch (DuplicateKeyException concurrentInsert) {
                log.debug("Notification {} for skill {} already recorded", notification.type(), notification.skillId());
                return false;
            }
        });
    }

    private boolean notificationExists(Notification notification) {
        Integer existing = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM notifications WHERE user_id = ? AND skill_id = ? AND type = ?",
                Integer.class, notification.userId(), notification.skillId(), notification.type());
        return existing != null && existing > 0;
    }

    private boolean insertNotification(Notification notification) {
        jdbcTemplate.update(
                "INSERT INTO notifications (id, user_id, skill_id, type, title, message, is_read, created_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?, FALSE, ?)",
                notification.id(), notification.userId(), notification.skillId(), notification.type(),
                notification.title(), notification.message(), millis(notification.createdAt()));
        return true;
    }

    @Override
    public void replaceCategories(String skillId, List<String> categorySlugs, double confidence,
            ClassificationMethod method, CategorySuggestion suggestion, Instant now) {
        inStore("replaceCategories", () -> transactionTemplate.execute(status -> {
            if (suggestion != null && categorySlugs.contains(suggestion.slug())) {
                saveSuggestedCategory(suggestion, skillId, now);
            }
            jdbcTemplate.update("DELETE FROM skill_categories WHERE skill_id = ?", skillId);
            List<Object[]> rows = categorySlugs.stream()
                    .distinct()
                    .map(slug -> new Object[] {skillId, slug, confidence})
                    .collect(Collectors.toList());
            jdbcTemplate.batchUpdate(
                    "INSERT INTO skill_categories (skill_id, category_slug, confidence) VALUES (?, ?, ?)", rows);
            jdbcTemplate.update("UPDATE skills SET classification_method = ?, updated_at = ? WHERE id = ?",
                    method.wireValue(), millis(now), skillId);
            return null;
        }));
    }

    @Override
    public List<String> findCategorySlugs(String skillId) {
        return inStore("findCategorySlugs", () -> jdbcTemplate.queryForList(
                "SELECT category_slug FROM skill_categories WHERE skill_id = ? ORDER BY category_slug",
                String.class, skillId));
    }

    @Override
    public List<String> findTags(String skillId) {
        return inStore("findTags", () -> jdbcTemplate.queryForList(
                "SELECT tag FROM skill_tags WHERE skill_id = ? ORDER BY tag", String.class, skillId));
    }

    @Override
    public List<CategoryDefinition> findCustomCategories() {
        return inStore("findCustomCategories", () -> jdbcTemplate.query(
                "SELECT slug, name, description FROM categories ORDER BY slug",
                (rs, rowNum) -> new CategoryDefinition(
                        rs.getString("slug"), rs.getString("name"), rs.getString("description"), List.of())));
    }

    private void saveSuggestedCategory(CategorySuggestion suggestion, String suggestedBySkillId, Instant now) {
        if (incrementCategoryUsage(suggestion.slug(), now) > 0) {
            return;
        }
        jdbcTemplate.update(
                "INSERT INTO categories (slug, name, description, suggested_by_skill_id, usage_count, "
                        + "created_at, updated_at) VALUES (?, ?, ?, ?, 1, ?, ?)",
                suggestion.slug(), suggestion.name(), suggestion.description(), suggestedBySkillId,
                millis(now), millis(now));
    }

    private int incrementCategoryUsage(String slug, Instant now) {
        return jdbcTemplate.update(
                "UPDATE categories SET usage_count = usage_count + 1, updated_at = ? WHERE slug = ?", millis(now), slug);
    }

    @Override
    public List<SkillRecord> findDueByTier(SkillTier tier, Instant now, int limit) {
        return inStore("findDueByTier", () -> jdbcTemplate.query(
                SELECT_SKILLS + "WHERE tier = ? AND (next_update_at IS NULL OR next_update_at <= ?) "
                        + "ORDER BY COALESCE(next_update_at, 0), id LIMIT ?",
                skillRowMapper, tier.wireValue(), millis(now), limit));
    }

    @Override
    public void applyRefreshes(List<SkillRefresh> refreshes) {
        if (refreshes.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(refreshes.size());
        for (SkillRefresh refresh : refreshes) {
            rows.add(new Object[] {
                refresh.stars(), refresh.forks(), writeSnapshots(refresh.starSnapshots()), millis(refresh.lastCommitAt()),
                refresh.trendingScore(), refresh.tier().wireValue(), millis(refresh.nextUpdateAt()),
                millis(refresh.updatedAt()), refresh.skillId(), SkillTier.ARCHIVED.wireValue()
            });
        }
        inStore("applyRefreshes", () -> transactionTemplate.execute(status -> jdbcTemplate.batchUpdate(
                "UPDATE skills SET stars = ?, forks = ?, star_snapshots = ?, last_commit_at = ?, trending_score = ?, "
                        + "tier = ?, next_update_at = ?, updated_at = ? WHERE id = ? AND tier <> ?",
                rows)));
    }

    @Override
    public void recordAccess(String skillId, Instant now) {
        inStore("recordAccess", () -> jdbcTemplate.update(
                "UPDATE skills SET last_accessed_at = ?, access_count_7d = access_count_7d + 1, "
                        + "access_count_30d = access_count_30d + 1 WHERE id = ?",
                millis(now), skillId));
    }

    @Override
    public void recordDownload(String skillId, Instant occurredAt) {
        inStore("recordDownload", () -> jdbcTemplate.update(
                "INSERT INTO download_events (skill_id, occurred_at) VALUES (?, ?)", skillId, millis(occurredAt)));
    }

    @Override
    public int refreshDownloadCounts(Instant now) {
        long weekAgo = millis(now.minus(Duration.ofDays(7)));
        long monthAgo = millis(now.minus(Duration.ofDays(30)));
        return inStore("refreshDownloadCounts", () -> jdbcTemplate.update(
                "UPDATE skills SET "
                        + "download_count_7d = (SELECT COUNT(*) FROM download_events e "
                        + "WHERE e.skill_id = skills.id AND e.occurred_at >= ?), "
                        + "download_count_30d = (SELECT COUNT(*) FROM download_events e "
                        + "WHERE e.skill_id = skills.id AND e.occurred_at >= ?) "
                        + "WHERE download_count_7d > 0 OR download_count_30d > 0 "
                        + "OR id IN (SELECT skill_id FROM download_events WHERE occurred_at >= ?)",
                weekAgo, monthAgo, monthAgo));
    }

    @Override
    public int pruneDownloadEvents(Instant olderThan) {
        return inStore("pruneDownloadEvents", () -> jdbcTemplate.update(
                "DELETE FROM download_events WHERE occurred_at < ?", millis(olderThan)));
    }

    @Override
    public int resetStaleAccessCounts(Instant now) {
        long weekAgo = millis(now.minus(Duration.ofDays(7)));
        long monthAgo = millis(now.minus(Duration.ofDays(30)));
        Integer reset = inStore("resetStaleAccessCounts", () -> transactionTemplate.execute(status ->
                jdbcTemplate.update("UPDATE skills SET access_count_7d = 0 WHERE access_count_7d > 0 "
                        + "AND (last_accessed_at IS NULL OR last_accessed_at < ?)", weekAgo)
                + jdbcTemplate.update("UPDATE skills SET access_count_30d = 0 WHERE access_count_30d > 0 "
                        + "AND (last_accessed_at IS NULL OR last_accessed_at < ?)", monthAgo)));
        return reset == null ? 0 : reset;
    }

    @Override
    public List<SkillRecord> findArchiveCandidates(Instant accessCutoff, int starsBelow, Instant pushCutoff, int limit) {
        return inStore("findArchiveCandidates", () -> jdbcTemplate.query(
                SELECT_SKILLS + "WHERE visibility = ? AND tier <> ? AND stars < ? "
                        + "AND COALESCE(last_accessed_at, created_at) < ? "
                        + "AND (last_commit_at IS NULL OR last_commit_at < ?) ORDER BY id LIMIT ?",
                skillRowMapper, Visibility.PUBLIC.wireValue(), SkillTier.ARCHIVED.wireValue(), starsBelow,
                millis(accessCutoff), millis(pushCutoff), limit));
    }

    @Override
    public void markArchived(String skillId, Instant now) {
        inStore("markArchived", () -> transactionTemplate.execute(status -> {
            jdbcTemplate.update("DELETE FROM skill_categories WHERE skill_id = ?", skillId);
            jdbcTemplate.update(
                    "UPDATE skills SET tier = ?, star_snapshots = NULL, next_update_at = NULL, updated_at = ? "
                            + "WHERE id = ?",
                    SkillTier.ARCHIVED.wireValue(), millis(now), skillId);
            return null;
        }));
    }

    @Override
    public List<SkillRecord> findArchived(String afterId, int limit) {
        return inStore("findArchived", () -> jdbcTemplate.query(
                SELECT_SKILLS + "WHERE tier = ? AND id > ? ORDER BY id LIMIT ?",
                skillRowMapper, SkillTier.ARCHIVED.wireValue(), afterId == null ? "" : afterId, limit));
    }

    @Override
    public void markResurrected(
            String skillId, List<String> categorySlugs, List<StarSnapshot> starSnapshots, Instant now) {
        inStore("markResurrected", () -> transactionTemplate.execute(status -> {
            jdbcTemplate.update(
                    "UPDATE skills SET tier = ?, last_accessed_at = ?, next_update_at = NULL, star_snapshots = ?, "
                            + "updated_at = ? WHERE id = ? AND tier = ?",
                    SkillTier.COLD.wireValue(), millis(now), writeSnapshots(starSnapshots), millis(now), skillId,
                    SkillTier.ARCHIVED.wireValue());
            Set<String> existing = new HashSet<>(findCategorySlugs(skillId));
            for (String slug : categorySlugs) {
                if (existing.add(slug)) {
                    jdbcTemplate.update(
                            "INSERT INTO skill_categories (skill_id, category_slug, confidence) VALUES (?, ?, NULL)",
                            skillId, slug);
                }
            }
            return null;
        }));
    }

    @Override
    public List<ListingEntry> findListing(ListingKind kind, int limit) {
        String orderBy = switch (kind) {
            case TRENDING -> "trending_score DESC, stars DESC, indexed_at DESC, id";
            case TOP -> "stars DESC, id";
            case RECENT -> "indexed_at DESC, id";
        };
        return inStore("findListing", () -> jdbcTemplate.query(
                "SELECT id, slug, name, description, repo_owner, repo_name, skill_path, stars, forks, trending_score, "
                        + "updated_at FROM skills WHERE visibility = ? AND tier <> ? ORDER BY " + orderBy + " LIMIT ?",
                (rs, rowNum) -> new ListingEntry(
                        rs.getString("id"), rs.getString("slug"), rs.getString("name"), rs.getString("description"),
                        rs.getString("repo_owner"), rs.getString("repo_name"), rs.getString("skill_path"),
                        rs.getInt("stars"), rs.getInt("forks"), rs.getDouble("trending_score"),
                        rs.getLong("updated_at")),
                Visibility.PUBLIC.wireValue(), SkillTier.ARCHIVED.wireValue(), limit));
    }

    private SkillRecord mapSkill(ResultSet rs, int rowNum) throws SQLException {
        return SkillRecord.builder()
                .id(rs.getString("id"))
                .slug(rs.getString("slug"))
                .identity(RepositoryIdentity.of(
                        rs.getString("repo_owner"), rs.getString("repo_name"), rs.getString("skill_path")))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .stars(rs.getInt("stars"))
                .forks(rs.getInt("forks"))
                .starSnapshots(readSnapshots(rs.getString("star_snapshots")))
                .trendingScore(rs.getDouble("trending_score"))
                .lastCommitAt(instant(rs, "last_commit_at"))
                .contentHash(rs.getString("content_hash"))
                .contentCommitSha(rs.getString("content_commit_sha"))
                .tier(SkillTier.fromWireValue(rs.getString("tier")))
                .lastAccessedAt(instant(rs, "last_accessed_at"))
                .accessCount7d(rs.getInt("access_count_7d"))
                .accessCount30d(rs.getInt("access_count_30d"))
                .downloadCount7d(rs.getInt("download_count_7d"))
                .downloadCount30d(rs.getInt("download_count_30d"))
                .nextUpdateAt(instant(rs, "next_update_at"))
                .classificationMethod(ClassificationMethod.fromWireValue(rs.getString("classification_method")))
                .visibility(Visibility.fromWireValue(rs.getString("visibility")))
                .ownerUserId(rs.getString("owner_user_id"))
                .createdAt(instant(rs, "created_at"))
                .updatedAt(instant(rs, "updated_at"))
                .indexedAt(instant(rs, "indexed_at"))
                .build();
    }

    private List<StarSnapshot> readSnapshots(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, SNAPSHOT_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable star history: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private String writeSnapshots(List<StarSnapshot> snapshots) {
        try {
            return objectMapper.writeValueAsString(snapshots == null ? List.of() : snapshots);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Star history is not serializable", e);
        }
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static Long millis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private <T> T inStore(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            log.error("Skill store operation {} failed: {}", operation, e.getMessage());
            throw new SkillStoreException("Skill store operation " + operation + " failed", e);
        }
    }
}
