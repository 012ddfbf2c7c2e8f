package com.williamcallahan.skillcatalog.service.classification;

import com.williamcallahan.skillcatalog.domain.ClassificationMethod;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationMessage;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationPlan;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationResult;
import com.williamcallahan.skillcatalog.queue.PipelineJob;
import com.williamcallahan.skillcatalog.service.metrics.PipelineMetrics;
import com.williamcallahan.skillcatalog.store.BlobStore;
import com.williamcallahan.skillcatalog.store.SkillStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Consumes classification messages: picks a method, runs it and replaces the record's categories.
 */
@Service
public class ClassificationService implements PipelineJob<ClassificationMessage> {
    private static final Logger log = LoggerFactory.getLogger(ClassificationService.class);
    static final String METRICS_STAGE = "classification";

    private final SkillStore skillStore;
    private final BlobStore blobStore;
    private final ClassificationAdmissionPolicy admissionPolicy;
    private final KeywordClassifier keywordClassifier;
    private final AiClassificationChain aiClassificationChain;
    private final PipelineMetrics pipelineMetrics;
    private final Clock clock;

    public ClassificationService(
            SkillStore skillStore,
            BlobStore blobStore,
            ClassificationAdmissionPolicy admissionPolicy,
            KeywordClassifier keywordClassifier,
            AiClassificationChain aiClassificationChain,
            PipelineMetrics pipelineMetrics,
            Clock clock) {
        this.skillStore = skillStore;
        this.blobStore = blobStore;
        this.admissionPolicy = admissionPolicy;
        this.keywordClassifier = keywordClassifier;
        this.aiClassificationChain = aiClassificationChain;
        this.pipelineMetrics = pipelineMetrics;
        this.clock = clock;
    }

    @Override
    public String jobName() {
        return "classification";
    }

    @Override
    public void execute(ClassificationMessage message) {
        classify(message);
    }

    /**
     * Classifies one record.
     *
     * @return the method that produced the stored categories, or empty when nothing was written
     */
    public Optional<ClassificationMethod> classify(ClassificationMessage message) {
        Optional<SkillRecord> existing = skillStore.findById(message.skillId());
        if (existing.isEmpty() || existing.get().isArchived()) {
            log.info("Skipping classification of {}: record missing or archived", message.skillId());
            return Optional.empty();
        }
        SkillRecord skill = existing.get();
        CategoryVocabulary vocabulary = CategoryVocabulary.withCustom(skillStore.findCustomCategories());
        int stars = message.stars() != null ? message.stars() : skill.stars();
        ClassificationPlan plan = admissionPolicy.plan(
                message.repoOwner(), stars, message.frontmatterCategories(), message.reclassification(), vocabulary);

        ClassificationMethod method = plan.method();
        ClassificationResult result;
        switch (method) {
            case DIRECT:
                result = ((ClassificationPlan.Direct) plan).result();
                break;
            case KEYWORD: {
                Optional<String> content = readMarkerContent(message.skillMdPath());
                if (content.isEmpty()) {
                    log.warn("Marker content {} missing or empty, leaving {} unclassified", message.skillMdPath(), skill.slug());
                    return Optional.empty();
                }
                result = keywordClassifier.classify(content.get(), message.tags(), vocabulary);
                break;
            }
            case AI: {
                Optional<String> content = readMarkerContent(message.skillMdPath());
                if (content.isEmpty()) {
                    log.warn("Marker content {} missing or empty, leaving {} unclassified", message.skillMdPath(), skill.slug());
                    return Optional.empty();
                }
                Optional<ClassificationResult> aiResult =
                        aiClassificationChain.classify(content.get(), message.tags(), vocabulary);
                if (aiResult.isPresent()) {
                    result = aiResult.get();
                } else {
                    log.warn("All AI attempts failed for {}, using keyword classification", skill.slug());
                    result = keywordClassifier.classify(content.get(), message.tags(), vocabulary);
                    method = ClassificationMethod.KEYWORD;
                }
                break;
            }
            default:
                throw new IllegalStateException("Unhandled classification method " + method);
        }

        Instant now = clock.instant();
        skillStore.replaceCategories(skill.id(), result.categories(), result.confidence(), method,
                result.suggestion().orElse(null), now);
        pipelineMetrics.record(METRICS_STAGE, PipelineMetrics.hourly(now), PipelineMetrics.CLASSIFICATION_TTL,
                Map.of(method.wireValue(), 1L, "total", 1L));
        log.info("Classified {} as {} via {} (confidence {})",
                skill.slug(), result.categories(), method.wireValue(), result.confidence());
        return Optional.of(method);
    }

    private Optional<String> readMarkerContent(String skillMdPath) {
        Optional<String> content = readNonBlank(skillMdPath);
        if (content.isPresent()) {
            return content;
        }
        if (skillMdPath.endsWith("/SKILL.md")) {
            return readNonBlank(skillMdPath.substring(0, skillMdPath.length() - "SKILL.md".length()) + "skill.md");
        }
        if (skillMdPath.endsWith("/skill.md")) {
            return readNonBlank(skillMdPath.substring(0, skillMdPath.length() - "skill.md".length()) + "SKILL.md");
        }
        return Optional.empty();
    }

    private Optional<String> readNonBlank(String key) {
        return blobStore.getText(key).filter(text -> !text.isBlank());
    }
}
