package com.williamcallahan.skillcatalog.domain.classification;

import java.util.List;
import java.util.Optional;

/**
 * Validated outcome of a classification method.
 *
 * @param categories one to three category slugs
 * @param confidence confidence in [0, 1]
 * @param reasoning short rationale, may be empty
 * @param suggestedCategory validated new category, or null
 */
public record ClassificationResult(
        List<String> categories, double confidence, String reasoning, CategorySuggestion suggestedCategory) {

    public ClassificationResult {
        categories = categories == null ? List.of() : List.copyOf(categories);
        if (categories.isEmpty() || categories.size() > 3) {
            throw new IllegalArgumentException("A classification carries one to three categories");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }
        reasoning = reasoning == null ? "" : reasoning;
    }

    public static ClassificationResult of(List<String> categories, double confidence, String reasoning) {
        return new ClassificationResult(categories, confidence, reasoning, null);
    }

    public Optional<CategorySuggestion> suggestion() {
        return Optional.ofNullable(suggestedCategory);
    }
}
