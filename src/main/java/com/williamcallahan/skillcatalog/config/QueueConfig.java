package com.williamcallahan.skillcatalog.config;

import com.williamcallahan.skillcatalog.domain.classification.ClassificationMessage;
import com.williamcallahan.skillcatalog.domain.ingestion.IngestionMessage;
import com.williamcallahan.skillcatalog.queue.InMemoryWorkQueue;
import com.williamcallahan.skillcatalog.queue.QueueJobBinding;
import com.williamcallahan.skillcatalog.service.classification.ClassificationService;
import com.williamcallahan.skillcatalog.service.ingestion.SkillIngestionService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

@Configuration
public class QueueConfig {

    @Bean
    public InMemoryWorkQueue<IngestionMessage> ingestionQueue(AppProperties appProperties, TaskScheduler taskScheduler) {
        return newQueue("ingestion", appProperties.getQueue(), taskScheduler);
    }

    @Bean
    public InMemoryWorkQueue<ClassificationMessage> classificationQueue(
            AppProperties appProperties, TaskScheduler taskScheduler) {
        return newQueue("classification", appProperties.getQueue(), taskScheduler);
    }

    @Bean
    public QueueJobBinding<IngestionMessage> ingestionBinding(
            InMemoryWorkQueue<IngestionMessage> ingestionQueue,
            SkillIngestionService skillIngestionService,
            AppProperties appProperties) {
        AppProperties.Queue settings = appProperties.getQueue();
        return new QueueJobBinding<>(
                ingestionQueue, skillIngestionService, settings.getIngestionWorkers(), settings.getPollTimeout());
    }

    @Bean
    public QueueJobBinding<ClassificationMessage> classificationBinding(
            InMemoryWorkQueue<ClassificationMessage> classificationQueue,
            ClassificationService classificationService,
            AppProperties appProperties) {
        AppProperties.Queue settings = appProperties.getQueue();
        return new QueueJobBinding<>(classificationQueue, classificationService,
                settings.getClassificationWorkers(), settings.getPollTimeout());
    }

    private static <T> InMemoryWorkQueue<T> newQueue(
            String name, AppProperties.Queue settings, TaskScheduler taskScheduler) {
        return new InMemoryWorkQueue<>(
                name, settings.getMaxAttempts(), settings.getInitialBackoff(), settings.getMaxBackoff(), taskScheduler);
    }
}
