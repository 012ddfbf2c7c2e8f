package com.williamcallahan.skillcatalog.service.classification;

import com.williamcallahan.skillcatalog.domain.classification.CategoryDefinition;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the category vocabulary: built-in categories followed by persisted
 * custom ones. Built-in entries win when a custom slug collides.
 */
public final class CategoryVocabulary {
    private final Map<String, CategoryDefinition> bySlug;

    private CategoryVocabulary(Map<String, CategoryDefinition> bySlug) {
        this.bySlug = Collections.unmodifiableMap(bySlug);
    }

    public static CategoryVocabulary builtIn() {
        return withCustom(List.of());
    }

    public static CategoryVocabulary withCustom(Collection<CategoryDefinition> customCategories) {
        Map<String, CategoryDefinition> bySlug = new LinkedHashMap<>();
        BuiltInCategories.ALL.forEach(category -> bySlug.put(category.slug(), category));
        customCategories.forEach(category -> bySlug.putIfAbsent(category.slug(), category));
        return new CategoryVocabulary(bySlug);
    }

    public boolean contains(String slug) {
        return slug != null && bySlug.containsKey(slug.toLowerCase(Locale.ROOT));
    }

    public Optional<CategoryDefinition> find(String slug) {
        return slug == null ? Optional.empty() : Optional.ofNullable(bySlug.get(slug.toLowerCase(Locale.ROOT)));
    }

    public List<CategoryDefinition> categories() {
        return List.copyOf(bySlug.values());
    }

    public String fallbackSlug() {
        return BuiltInCategories.FALLBACK_SLUG;
    }
}
