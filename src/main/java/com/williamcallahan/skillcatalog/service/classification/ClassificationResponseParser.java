package com.williamcallahan.skillcatalog.service.classification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.skillcatalog.domain.classification.CategorySuggestion;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates a model reply into a {@link ClassificationResult}.
 *
 * <p>Unknown category slugs are dropped. A suggested category is kept only when its slug is
 * well formed and not already in the vocabulary. When no category survives, the suggestion's
 * slug is used if valid, otherwise the fallback category.</p>
 */
@Component
public class ClassificationResponseParser {
    private static final Logger log = LoggerFactory.getLogger(ClassificationResponseParser.class);
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");
    private static final Pattern SLUG = Pattern.compile("^[a-z0-9]+(?:-[a-z0-9]+)*$");
    static final int MAX_SLUG_LENGTH = 40;
    static final double DEFAULT_CONFIDENCE = 0.5;

    private final ObjectMapper objectMapper;

    public ClassificationResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws AiClassificationException when the reply carries no parseable JSON object
     */
    public ClassificationResult parse(String reply, CategoryVocabulary vocabulary) {
        Matcher matcher = JSON_OBJECT.matcher(reply == null ? "" : reply);
        if (!matcher.find()) {
            throw new AiClassificationException("No JSON found in response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException malformed) {
            throw new AiClassificationException("Malformed JSON in response: " + malformed.getOriginalMessage(), malformed);
        }

        List<String> categories = new ArrayList<>();
        for (JsonNode slugNode : root.path("categories")) {
            String slug = slugNode.asText("").trim().toLowerCase(Locale.ROOT);
            if (vocabulary.contains(slug) && !categories.contains(slug)
                    && categories.size() < ClassificationAdmissionPolicy.MAX_CATEGORIES) {
                categories.add(slug);
            }
        }

        CategorySuggestion suggestion = validSuggestion(root.path("suggestedCategory"), vocabulary);
        if (categories.isEmpty()) {
            categories.add(suggestion != null ? suggestion.slug() : vocabulary.fallbackSlug());
        }

        JsonNode confidenceNode = root.path("confidence");
        double confidence = confidenceNode.isNumber() && confidenceNode.asDouble() != 0.0
                ? confidenceNode.asDouble()
                : DEFAULT_CONFIDENCE;
        confidence = Math.min(1.0, Math.max(0.0, confidence));

        return new ClassificationResult(categories, confidence, root.path("reasoning").asText(""), suggestion);
    }

    private CategorySuggestion validSuggestion(JsonNode node, CategoryVocabulary vocabulary) {
        if (!node.isObject()) {
            return null;
        }
        String slug = node.path("slug").asText("").trim().toLowerCase(Locale.ROOT);
        String name = node.path("name").asText("").trim();
        String description = node.path("description").asText("").trim();
        if (slug.length() > MAX_SLUG_LENGTH || !SLUG.matcher(slug).matches() || name.isEmpty()) {
            log.debug("Ignoring malformed category suggestion '{}'", slug);
            return null;
        }
        if (vocabulary.contains(slug)) {
            return null;
        }
        return new CategorySuggestion(slug, name, description.isEmpty() ? null : description);
    }
}
