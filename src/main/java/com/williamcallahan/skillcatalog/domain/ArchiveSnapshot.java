package com.williamcallahan.skillcatalog.domain;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Cold-storage snapshot of an archived record, its category slugs and cached marker content.
 *
 * <p>Times are epoch milliseconds so the blob stays readable without a date module. Snapshots
 * written before the marker file name was recorded read back as {@code SKILL.md}.</p>
 */
public record ArchiveSnapshot(
        String id,
        String slug,
        String name,
        String description,
        String repoOwner,
        String repoName,
        String skillPath,
        int stars,
        int forks,
        List<StarSnapshot> starSnapshots,
        double trendingScore,
        Long lastCommitAt,
        Long lastAccessedAt,
        String classificationMethod,
        long createdAt,
        long indexedAt,
        List<String> categories,
        String skillMdContent,
        String skillMdFileName,
        long archivedAt) {

    public static final String DEFAULT_MARKER_FILE_NAME = "SKILL.md";

    public ArchiveSnapshot {
        skillMdFileName = skillMdFileName == null ? DEFAULT_MARKER_FILE_NAME : skillMdFileName;
        starSnapshots = starSnapshots == null ? List.of() : List.copyOf(starSnapshots);
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    /**
     * Captures a record for archival.
     *
     * @param skill record being archived
     * @param categories current category slugs
     * @param skillMdContent cached marker content, may be null
     * @param skillMdFileName file name the content was cached under, null for the default
     * @param archivedAt archival time
     * @return snapshot ready for serialization
     */
    public static ArchiveSnapshot capture(SkillRecord skill, List<String> categories, String skillMdContent,
            String skillMdFileName, Instant archivedAt) {
        RepositoryIdentity identity = skill.identity();
        return new ArchiveSnapshot(
                skill.id(),
                skill.slug(),
                skill.name(),
                skill.description(),
                identity.owner(),
                identity.name(),
                identity.skillPath(),
                skill.stars(),
                skill.forks(),
                skill.starSnapshots(),
                skill.trendingScore(),
                toMillis(skill.lastCommitAt()),
                toMillis(skill.lastAccessedAt()),
                skill.classificationMethod() == null ? null : skill.classificationMethod().wireValue(),
                skill.createdAt().toEpochMilli(),
                skill.indexedAt().toEpochMilli(),
                categories,
                skillMdContent,
                skillMdFileName,
                archivedAt.toEpochMilli());
    }

    /**
     * Returns the blob key for a record's archive: {@code archive/{yyyy}/{MM}/{id}.json},
     * partitioned by the record's creation month.
     */
    public static String blobKey(SkillRecord skill) {
        ZonedDateTime created = skill.createdAt().atZone(ZoneOffset.UTC);
        return String.format("archive/%04d/%02d/%s.json", created.getYear(), created.getMonthValue(), skill.id());
    }

    private static Long toMillis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }
}
