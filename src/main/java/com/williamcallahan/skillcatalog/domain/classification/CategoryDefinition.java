package com.williamcallahan.skillcatalog.domain.classification;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the category vocabulary.
 *
 * @param slug unique lower-case slug
 * @param name display name
 * @param description short description used in classification prompts
 * @param keywords whole-word keywords used by keyword classification
 */
public record CategoryDefinition(String slug, String name, String description, List<String> keywords) {
    public CategoryDefinition {
        Objects.requireNonNull(slug, "slug");
        Objects.requireNonNull(name, "name");
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
