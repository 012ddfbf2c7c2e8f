package com.williamcallahan.skillcatalog.domain.classification;

import java.util.Objects;

/**
 * New category proposed by the AI classifier when nothing in the vocabulary fits.
 *
 * @param slug proposed slug
 * @param name proposed display name
 * @param description proposed description
 */
public record CategorySuggestion(String slug, String name, String description) {
    public CategorySuggestion {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Converts the suggestion into a vocabulary entry without keywords.
     */
    public CategoryDefinition toDefinition() {
        return new CategoryDefinition(slug, name, description, java.util.List.of());
    }
}
