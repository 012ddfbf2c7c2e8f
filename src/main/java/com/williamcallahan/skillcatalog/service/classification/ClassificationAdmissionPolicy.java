package com.williamcallahan.skillcatalog.service.classification;

import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationPlan;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationResult;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Chooses how a record is classified. Every record gets at least keyword classification.
 */
@Component
public class ClassificationAdmissionPolicy {
    static final Set<String> KNOWN_ORGS = Set.of(
            "anthropics", "openai", "google", "microsoft", "facebook", "meta", "vercel",
            "cloudflare", "supabase", "prisma", "drizzle-team", "sveltejs", "vuejs", "reactjs");
    static final int MAX_CATEGORIES = 3;
    static final String DIRECT_REASONING = "Directly matched from SKILL.md frontmatter";

    private final AppProperties appProperties;

    public ClassificationAdmissionPolicy(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    /**
     * Picks the plan for one classification request.
     *
     * @param owner repository owner
     * @param stars current stars
     * @param declaredCategories front-matter categories
     * @param reclassification forces the AI path and disables the direct match
     * @param vocabulary known categories
     */
    public ClassificationPlan plan(
            String owner, int stars, List<String> declaredCategories, boolean reclassification,
            CategoryVocabulary vocabulary) {
        if (reclassification) {
            return ClassificationPlan.ai();
        }
        Optional<ClassificationResult> direct = tryDirectMatch(declaredCategories, vocabulary);
        if (direct.isPresent()) {
            return ClassificationPlan.direct(direct.get());
        }
        return determineMethod(owner, stars);
    }

    /**
     * AI for popular repositories and known organizations, keyword otherwise.
     */
    public ClassificationPlan determineMethod(String owner, int stars) {
        if (stars >= appProperties.getClassification().getAiStarThreshold()) {
            return ClassificationPlan.ai();
        }
        if (owner != null && KNOWN_ORGS.contains(owner.toLowerCase(Locale.ROOT))) {
            return ClassificationPlan.ai();
        }
        return ClassificationPlan.keyword();
    }

    /**
     * Uses declared categories that exist in the vocabulary, at full confidence.
     */
    public Optional<ClassificationResult> tryDirectMatch(List<String> declaredCategories, CategoryVocabulary vocabulary) {
        if (declaredCategories == null || declaredCategories.isEmpty()) {
            return Optional.empty();
        }
        List<String> matched = declaredCategories.stream()
                .map(category -> category.trim().toLowerCase(Locale.ROOT))
                .filter(vocabulary::contains)
                .distinct()
                .limit(MAX_CATEGORIES)
                .collect(Collectors.toList());
        if (matched.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ClassificationResult.of(matched, 1.0, DIRECT_REASONING));
    }
}
