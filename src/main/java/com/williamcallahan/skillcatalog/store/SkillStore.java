package com.williamcallahan.skillcatalog.store;

import com.williamcallahan.skillcatalog.domain.ClassificationMethod;
import com.williamcallahan.skillcatalog.domain.ContentFingerprint;
import com.williamcallahan.skillcatalog.domain.DuplicateCandidate;
import com.williamcallahan.skillcatalog.domain.ListingEntry;
import com.williamcallahan.skillcatalog.domain.ListingKind;
import com.williamcallahan.skillcatalog.domain.Notification;
import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.domain.SkillRefresh;
import com.williamcallahan.skillcatalog.domain.SkillTier;
import com.williamcallahan.skillcatalog.domain.StarSnapshot;
import com.williamcallahan.skillcatalog.domain.classification.CategoryDefinition;
import com.williamcallahan.skillcatalog.domain.classification.CategorySuggestion;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Relational store for catalog records and their satellite rows.
 *
 * <p>Every method that issues more than one statement does so in a single atomic unit bounded
 * to roughly one hundred statements; there are no transactions spanning calls. Writes are keyed
 * by natural identity so re-running a unit of work converges instead of duplicating.
 * Implementations wrap persistence failures in {@link SkillStoreException}.</p>
 */
public interface SkillStore {

    Optional<SkillRecord> findById(String skillId);

    Optional<SkillRecord> findByIdentity(RepositoryIdentity identity);

    List<SkillRecord> findByIds(Collection<String> skillIds);

    boolean slugExists(String slug);

    /**
     * Inserts or updates a record with its fingerprints and tags in one unit.
     * Slug, id and creation time of an existing record are never changed.
     *
     * @param skill record to persist
     * @param fingerprints content hashes, upserted by (skillId, hashType)
     * @param tags declared tags, inserted when absent
     */
    void saveIngestedSkill(SkillRecord skill, List<ContentFingerprint> fingerprints, Collection<String> tags);

    /**
     * Updates only popularity counters of a record whose content did not change.
     */
    void updatePopularity(String skillId, int stars, int forks, Instant lastCommitAt, Instant now);

    /**
     * Finds the most-starred public record with a matching normalized content hash.
     *
     * @param normalizedHash normalized content hash
     * @param minStars minimum stars of the matching record
     * @param excludeSkillId record to ignore, may be null
     * @return best matching record
     */
    Optional<DuplicateCandidate> findPublicDuplicate(String normalizedHash, int minStars, String excludeSkillId);

    /**
     * Finds the earliest record with matching raw content that is still private or was already
     * converted from private to public.
     */
    Optional<SkillRecord> findCurationMatchByFullHash(String fullHash);

    /**
     * Makes a private record public, marks it curated and stores the owner notification in one unit.
     *
     * @param notification owner notification, null when the record has no owner
     * @return true when a notification row was inserted
     */
    boolean convertToPublic(String skillId, Notification notification, Instant now);

    /**
     * Inserts the notification unless one already exists for its (userId, skillId, type).
     *
     * @return true when a row was inserted
     */
    boolean insertNotificationIfAbsent(Notification notification);

    /**
     * Atomically replaces a record's category links and records the method used. A suggested category
     * is inserted, or its usage incremented, in the same unit and only when its slug is among the links.
     *
     * @param suggestion category proposed by the classifier, null when none was proposed
     */
    void replaceCategories(String skillId, List<String> categorySlugs, double confidence, ClassificationMethod method,
            CategorySuggestion suggestion, Instant now);

    List<String> findCategorySlugs(String skillId);

    List<String> findTags(String skillId);

    List<CategoryDefinition> findCustomCategories();

    /**
     * Returns records of a tier whose next update is unset or due, oldest schedule first.
     */
    List<SkillRecord> findDueByTier(SkillTier tier, Instant now, int limit);

    /**
     * Applies one sub-batch of tier refresh results atomically.
     */
    void applyRefreshes(List<SkillRefresh> refreshes);

    void recordAccess(String skillId, Instant now);

    void recordDownload(String skillId, Instant occurredAt);

    /**
     * Recomputes rolling download counters from raw events.
     *
     * @return number of records updated
     */
    int refreshDownloadCounts(Instant now);

    int pruneDownloadEvents(Instant olderThan);

    /**
     * Zeroes access counters whose window has elapsed without an access.
     *
     * @return number of records updated
     */
    int resetStaleAccessCounts(Instant now);

    /**
     * Selects public, non-archived records with no access since {@code accessCutoff}, fewer than
     * {@code starsBelow} stars and no push since {@code pushCutoff}. A record that was never
     * accessed counts from its creation time; an unknown push time counts as inactive.
     */
    List<SkillRecord> findArchiveCandidates(Instant accessCutoff, int starsBelow, Instant pushCutoff, int limit);

    /**
     * Deletes category links, clears star history and moves the record to the archived tier.
     */
    void markArchived(String skillId, Instant now);

    /**
     * Returns archived records ordered by id, starting after {@code afterId} when given.
     */
    List<SkillRecord> findArchived(String afterId, int limit);

    /**
     * Moves an archived record back to the cold tier and restores its categories and history.
     */
    void markResurrected(String skillId, List<String> categorySlugs, List<StarSnapshot> starSnapshots, Instant now);

    List<ListingEntry> findListing(ListingKind kind, int limit);
}
