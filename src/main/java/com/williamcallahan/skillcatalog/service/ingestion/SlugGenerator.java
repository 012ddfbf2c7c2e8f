package com.williamcallahan.skillcatalog.service.ingestion;

import com.williamcallahan.skillcatalog.domain.RepositoryIdentity;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Assigns the permanent URL slug of a new record.
 *
 * <p>Root skills use {@code owner-name}. Skills in a subdirectory append their declared name,
 * falling back to the subpath when that slug is taken. Any remaining collision gets a numeric
 * suffix.</p>
 */
@Component
public class SlugGenerator {
    static final int MAX_SLUG_LENGTH = 200;

    private final SkillStore skillStore;

    public SlugGenerator(SkillStore skillStore) {
        this.skillStore = skillStore;
    }

    public String generate(RepositoryIdentity identity, String declaredName) {
        String base = slugify(identity.owner() + "-" + identity.name());
        if (!identity.hasSkillPath()) {
            return unique(base);
        }
        String byName = declaredName == null ? "" : slugify(declaredName);
        if (!byName.isEmpty()) {
            String candidate = truncate(base + "-" + byName);
            if (!skillStore.slugExists(candidate)) {
                return candidate;
            }
        }
        return unique(truncate(base + "-" + slugify(identity.skillPath().replace('/', '-'))));
    }

    /**
     * Lower-cases and replaces everything outside {@code [a-z0-9-]} with dashes.
     */
    public static String slugify(String value) {
        String slug = value.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^-|-$", "");
        return truncate(slug);
    }

    private String unique(String candidate) {
        if (!skillStore.slugExists(candidate)) {
            return candidate;
        }
        for (int suffix = 2; ; suffix++) {
            String tail = "-" + suffix;
            String suffixed = candidate.substring(0, Math.min(candidate.length(), MAX_SLUG_LENGTH - tail.length())) + tail;
            if (!skillStore.slugExists(suffixed)) {
                return suffixed;
            }
        }
    }

    private static String truncate(String slug) {
        if (slug.length() <= MAX_SLUG_LENGTH) {
            return slug;
        }
        return slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
    }
}
