package com.williamcallahan.skillcatalog.service.classification;

import com.williamcallahan.skillcatalog.config.AppProperties;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Builds the classification prompt from the vocabulary, declared tags and marker content.
 */
@Component
public class ClassificationPromptBuilder {
    private final AppProperties appProperties;

    public ClassificationPromptBuilder(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    public String build(String skillMdContent, List<String> tags, CategoryVocabulary vocabulary) {
        String categories = vocabulary.categories().stream()
                .map(category -> "- " + category.slug() + ": " + category.name()
                        + (category.description() == null ? "" : " - " + category.description())
                        + (category.keywords().isEmpty() ? "" : " (keywords: " + String.join(", ", category.keywords()) + ")"))
                .collect(Collectors.joining("\n"));
        String tagsHint = tags == null || tags.isEmpty()
                ? ""
                : "\nAuthor-provided tags (use as hints for classification): " + String.join(", ", tags) + "\n";
        int budget = appProperties.getClassification().getMaxContentChars();
        String content = skillMdContent.length() > budget ? skillMdContent.substring(0, budget) : skillMdContent;

        return "You are a skill classifier for agent skills. Analyze the following SKILL.md content and "
                + "classify it into 1-3 most relevant categories.\n\n"
                + "Available categories:\n" + categories + "\n"
                + tagsHint + "\n"
                + "SKILL.md content:\n---\n" + content + "\n---\n\n"
                + "Respond with a JSON object containing:\n"
                + "- categories: array of category slugs (1-3 items, most relevant first)\n"
                + "- confidence: number between 0 and 1\n"
                + "- reasoning: brief explanation of why these categories were chosen\n"
                + "- suggestedCategory: optional object {\"slug\", \"name\", \"description\"} proposing ONE new "
                + "category, only when none of the available categories fits\n\n"
                + "Example response:\n"
                + "{\"categories\": [\"git\", \"automation\"], \"confidence\": 0.85, "
                + "\"reasoning\": \"This skill automates git commit message generation\"}\n\n"
                + "Respond ONLY with the JSON object, no other text.";
    }
}
