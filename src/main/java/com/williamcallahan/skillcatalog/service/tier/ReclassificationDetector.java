package com.williamcallahan.skillcatalog.service.tier;

import com.williamcallahan.skillcatalog.config.AppProperties;
import com.williamcallahan.skillcatalog.domain.ClassificationMethod;
import com.williamcallahan.skillcatalog.domain.SkillRecord;
import com.williamcallahan.skillcatalog.domain.SkillRefresh;
import com.williamcallahan.skillcatalog.domain.classification.ClassificationMessage;
import com.williamcallahan.skillcatalog.queue.WorkQueue;
import com.williamcallahan.skillcatalog.service.ingestion.MarkerFileLocator;
import com.williamcallahan.skillcatalog.store.SkillStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Requests AI reclassification for keyword-classified records whose stars just crossed the AI threshold.
 */
@Component
public class ReclassificationDetector {
    private static final Logger log = LoggerFactory.getLogger(ReclassificationDetector.class);

    private final SkillStore skillStore;
    private final WorkQueue<ClassificationMessage> classificationQueue;
    private final AppProperties appProperties;

    public ReclassificationDetector(
            SkillStore skillStore, WorkQueue<ClassificationMessage> classificationQueue, AppProperties appProperties) {
        this.skillStore = skillStore;
        this.classificationQueue = classificationQueue;
        this.appProperties = appProperties;
    }

    /**
     * Enqueues a forced reclassification when the refresh moved the record across the threshold.
     *
     * @param previous record as selected before the refresh
     * @param refreshed values just written
     * @return true when a message was enqueued
     */
    public boolean checkCrossing(SkillRecord previous, SkillRefresh refreshed) {
        int threshold = appProperties.getClassification().getAiStarThreshold();
        boolean crossed = previous.stars() < threshold && refreshed.stars() >= threshold;
        if (!crossed || previous.classificationMethod() != ClassificationMethod.KEYWORD) {
            return false;
        }
        classificationQueue.enqueue(new ClassificationMessage(
                previous.id(),
                previous.identity().owner(),
                previous.identity().name(),
                previous.identity().blobPrefix() + "/" + MarkerFileLocator.MARKER_FILE_NAMES.get(0),
                null,
                skillStore.findTags(previous.id()),
                refreshed.stars(),
                true));
        log.info("{} crossed {} stars, queued for AI reclassification", previous.slug(), threshold);
        return true;
    }
}
