package com.williamcallahan.skillcatalog.service.classification;

import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs the ordered list of AI classification attempts until one yields a valid result.
 *
 * <p>The list is: primary model, the primary model again, one random alternate model on the
 * primary provider, then the secondary provider's model. Attempts whose provider has no
 * credentials are left out.</p>
 */
@Component
public class AiClassificationChain {
    private static final Logger log = LoggerFactory.getLogger(AiClassificationChain.class);

    private final AiProviders aiProviders;
    private final AppProperties appProperties;
    private final ClassificationPromptBuilder promptBuilder;
    private final ClassificationResponseParser responseParser;
    private final Random random;

    @Autowired
    public AiClassificationChain(
            AiProviders aiProviders,
            AppProperties appProperties,
            ClassificationPromptBuilder promptBuilder,
            ClassificationResponseParser responseParser) {
        this(aiProviders, appProperties, promptBuilder, responseParser, new Random());
    }

    AiClassificationChain(
            AiProviders aiProviders,
            AppProperties appProperties,
            ClassificationPromptBuilder promptBuilder,
            ClassificationResponseParser responseParser,
            Random random) {
        this.aiProviders = aiProviders;
        this.appProperties = appProperties;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.random = random;
    }

    /**
     * One step of the chain.
     *
     * @param label log label
     * @param gateway provider to call
     * @param model model name passed to the provider
     */
    record Attempt(String label, ChatCompletionGateway gateway, String model) {
    }

    /**
     * Classifies with the first attempt that succeeds.
     *
     * @return the result, or empty when every attempt failed
     */
    public Optional<ClassificationResult> classify(String content, List<String> tags, CategoryVocabulary vocabulary) {
        String prompt = promptBuilder.build(content, tags, vocabulary);
        for (Attempt attempt : attempts()) {
            try {
                log.debug("Classifying with {} ({})", attempt.label(), attempt.model());
                String reply = attempt.gateway().complete(attempt.model(), prompt);
                return Optional.of(responseParser.parse(reply, vocabulary));
            } catch (AiClassificationException attemptFailure) {
                log.warn("{} attempt with {} failed: {}", attempt.label(), attempt.model(), attemptFailure.getMessage());
            }
        }
        return Optional.empty();
    }

    List<Attempt> attempts() {
        AppProperties.Classification settings = appProperties.getClassification();
        List<Attempt> attempts = new ArrayList<>();
        String primaryModel = primaryModel(settings);
        aiProviders.openRouter().ifPresent(openRouter -> {
            if (primaryModel == null) {
                log.info("No primary model configured, skipping {}", openRouter.providerName());
                return;
            }
            attempts.add(new Attempt("primary", openRouter, primaryModel));
            attempts.add(new Attempt("primary-retry", openRouter, primaryModel));
            List<String> alternates = settings.getAlternateModels().stream()
                    .map(String::trim)
                    .filter(model -> !model.isEmpty() && !model.equals(primaryModel))
                    .collect(Collectors.toList());
            if (!alternates.isEmpty()) {
                attempts.add(new Attempt("alternate", openRouter, alternates.get(random.nextInt(alternates.size()))));
            }
        });
        aiProviders.deepSeek().ifPresent(deepSeek ->
                attempts.add(new Attempt("secondary", deepSeek, settings.getSecondaryModel())));
        return attempts;
    }

    private static String primaryModel(AppProperties.Classification settings) {
        if (settings.getPrimaryModel() != null && !settings.getPrimaryModel().isBlank()) {
            return settings.getPrimaryModel().trim();
        }
        return settings.getAlternateModels().stream()
                .map(String::trim)
                .filter(model -> !model.isEmpty())
                .findFirst()
                .orElse(null);
    }
}
