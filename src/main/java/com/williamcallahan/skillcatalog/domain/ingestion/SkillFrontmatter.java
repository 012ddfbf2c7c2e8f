package com.williamcallahan.skillcatalog.domain.ingestion;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Structured fields read from a marker file's front-matter block.
 *
 * <p>Nested {@code metadata.*} values are fallbacks used only when the top-level field is
 * missing.</p>
 *
 * @param name declared skill name, may be null
 * @param description declared description, may be null
 * @param category single declared category, may be null
 * @param categories declared category list
 * @param keywords declared keywords or tags
 * @param metadataTags nested {@code metadata.tags}
 * @param metadataCategory nested {@code metadata.category}, may be null
 * @param metadataCategories nested {@code metadata.categories}
 */
public record SkillFrontmatter(
        String name,
        String description,
        String category,
        List<String> categories,
        List<String> keywords,
        List<String> metadataTags,
        String metadataCategory,
        List<String> metadataCategories) {

    public SkillFrontmatter {
        categories = categories == null ? List.of() : List.copyOf(categories);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        metadataTags = metadataTags == null ? List.of() : List.copyOf(metadataTags);
        metadataCategories = metadataCategories == null ? List.of() : List.copyOf(metadataCategories);
    }

    public static SkillFrontmatter empty() {
        return new SkillFrontmatter(null, null, null, List.of(), List.of(), List.of(), null, List.of());
    }

    /**
     * Returns declared category slugs, lower-cased and de-duplicated, preferring top-level fields.
     */
    public List<String> declaredCategories() {
        Set<String> declared = new LinkedHashSet<>();
        addNormalized(declared, categories);
        if (category != null) {
            addNormalized(declared, List.of(category));
        }
        if (declared.isEmpty()) {
            addNormalized(declared, metadataCategories);
            if (metadataCategory != null) {
                addNormalized(declared, List.of(metadataCategory));
            }
        }
        return List.copyOf(declared);
    }

    /**
     * Returns declared tags, lower-cased and de-duplicated, falling back to {@code metadata.tags}.
     */
    public List<String> declaredTags() {
        Set<String> tags = new LinkedHashSet<>();
        addNormalized(tags, keywords);
        if (tags.isEmpty()) {
            addNormalized(tags, metadataTags);
        }
        return List.copyOf(tags);
    }

    private static void addNormalized(Set<String> target, List<String> values) {
        for (String value : values) {
            if (value == null) {
                continue;
            }
            for (String part : value.split(",")) {
                String normalized = part.trim().toLowerCase(Locale.ROOT);
                if (!normalized.isEmpty()) {
                    target.add(normalized);
                }
            }
        }
    }
}
