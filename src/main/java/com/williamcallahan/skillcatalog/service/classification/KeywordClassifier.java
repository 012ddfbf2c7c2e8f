package com.williamcallahan.skillcatalog.service.classification;

import com.williamcallahan.skillcatalog.domain.classification.CategoryDefinition;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Scores categories by whole-word keyword hits in the marker content, boosted by declared tags.
 */
@Component
public class KeywordClassifier {
    static final int TAG_KEYWORD_BONUS = 3;
    static final int TAG_SLUG_BONUS = 5;
    static final double MATCH_CONFIDENCE = 0.6;
    static final double FALLBACK_CONFIDENCE = 0.3;

    public ClassificationResult classify(String content, List<String> tags, CategoryVocabulary vocabulary) {
        String text = content == null ? "" : content.toLowerCase(Locale.ROOT);
        Set<String> normalizedTags = tags == null ? Set.of() : tags.stream()
                .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        Map<String, Integer> scores = new LinkedHashMap<>();
        for (CategoryDefinition category : vocabulary.categories()) {
            int score = 0;
            for (String keyword : category.keywords()) {
                String normalizedKeyword = keyword.toLowerCase(Locale.ROOT);
                score += countWholeWord(text, normalizedKeyword);
                if (normalizedTags.contains(normalizedKeyword)) {
                    score += TAG_KEYWORD_BONUS;
                }
            }
            if (normalizedTags.contains(category.slug())) {
                score += TAG_SLUG_BONUS;
            }
            if (score > 0) {
                scores.put(category.slug(), score);
            }
        }

        if (scores.isEmpty()) {
            return ClassificationResult.of(List.of(vocabulary.fallbackSlug()), FALLBACK_CONFIDENCE,
                    "No keywords matched, defaulting to " + vocabulary.fallbackSlug());
        }
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(scores.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
        List<String> top = ranked.stream()
                .limit(ClassificationAdmissionPolicy.MAX_CATEGORIES)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        return ClassificationResult.of(top, MATCH_CONFIDENCE, "Classified by keyword matching");
    }

    private static int countWholeWord(String text, String keyword) {
        if (text.isEmpty()) {
            return 0;
        }
        Matcher matcher = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
