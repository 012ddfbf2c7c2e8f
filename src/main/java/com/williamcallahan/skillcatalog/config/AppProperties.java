package com.williamcallahan.skillcatalog.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed {@code app.*} configuration. Defaults match the pipeline's documented constants.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private GitHub github = new GitHub();
    private Ingestion ingestion = new Ingestion();
    private Classification classification = new Classification();
    private Tiers tiers = new Tiers();
    private Archive archive = new Archive();
    private Resurrection resurrection = new Resurrection();
    private Storage storage = new Storage();
    private Queue queue = new Queue();

    public GitHub getGithub() { return github; }
    public void setGithub(GitHub github) { this.github = github; }

    public Ingestion getIngestion() { return ingestion; }
    public void setIngestion(Ingestion ingestion) { this.ingestion = ingestion; }

    public Classification getClassification() { return classification; }
    public void setClassification(Classification classification) { this.classification = classification; }

    public Tiers getTiers() { return tiers; }
    public void setTiers(Tiers tiers) { this.tiers = tiers; }

    public Archive getArchive() { return archive; }
    public void setArchive(Archive archive) { this.archive = archive; }

    public Resurrection getResurrection() { return resurrection; }
    public void setResurrection(Resurrection resurrection) { this.resurrection = resurrection; }

    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }

    public Queue getQueue() { return queue; }
    public void setQueue(Queue queue) { this.queue = queue; }

    /**
     * Rejects non-positive caps, limits and thresholds.
     *
     * @throws IllegalArgumentException when a setting is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive(github.getGraphqlBatchSize(), "app.github.graphql-batch-size");
        if (github.getGraphqlBatchSize() > 50) {
            throw new IllegalArgumentException("app.github.graphql-batch-size must not exceed 50");
        }
        requirePositive(github.getMaxAttempts(), "app.github.max-attempts");
        requirePositive(ingestion.getMaxFiles(), "app.ingestion.max-files");
        requirePositive(ingestion.getMaxFileBytes(), "app.ingestion.max-file-bytes");
        requirePositive(ingestion.getMaxTotalBytes(), "app.ingestion.max-total-bytes");
        requirePositive(ingestion.getTrustedStarThreshold(), "app.ingestion.trusted-star-threshold");
        requirePositive(ingestion.getProtectedStarThreshold(), "app.ingestion.protected-star-threshold");
        requirePositive(classification.getAiStarThreshold(), "app.classification.ai-star-threshold");
        requirePositive(classification.getMaxContentChars(), "app.classification.max-content-chars");
        requirePositive(classification.getMaxOutputTokens(), "app.classification.max-output-tokens");
        requirePositive(tiers.getFlaggedCap(), "app.tiers.flagged-cap");
        requirePositive(tiers.getHotCap(), "app.tiers.hot-cap");
        requirePositive(tiers.getWarmCap(), "app.tiers.warm-cap");
        requirePositive(tiers.getCoolCap(), "app.tiers.cool-cap");
        requirePositive(tiers.getDownloadRetentionDays(), "app.tiers.download-retention-days");
        requirePositive(archive.getBatchLimit(), "app.archive.batch-limit");
        requirePositive(resurrection.getBatchSize(), "app.resurrection.batch-size");
        requirePositive(resurrection.getSweepStarThreshold(), "app.resurrection.sweep-star-threshold");
        requirePositive(resurrection.getOnDemandStarThreshold(), "app.resurrection.on-demand-star-threshold");
        requirePositive(resurrection.getActivityWindowDays(), "app.resurrection.activity-window-days");
        requirePositive(queue.getMaxAttempts(), "app.queue.max-attempts");
        requirePositive(queue.getIngestionWorkers(), "app.queue.ingestion-workers");
        requirePositive(queue.getClassificationWorkers(), "app.queue.classification-workers");
        if (resurrection.getInterBatchDelay().isNegative()) {
            throw new IllegalArgumentException("app.resurrection.inter-batch-delay must not be negative");
        }
    }

    private static void requirePositive(long value, String propertyName) {
        if (value <= 0) {
            throw new IllegalArgumentException(propertyName + " must be positive, got " + value);
        }
    }

    public static class GitHub {
        private String apiBaseUrl = "https://api.github.com";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int graphqlBatchSize = 50;
        private int maxAttempts = 3;

        public String getApiBaseUrl() { return apiBaseUrl; }
        public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

        public int getGraphqlBatchSize() { return graphqlBatchSize; }
        public void setGraphqlBatchSize(int graphqlBatchSize) { this.graphqlBatchSize = graphqlBatchSize; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class Ingestion {
        private int maxFiles = 50;
        private long maxFileBytes = 512L * 1024;
        private long maxTotalBytes = 5L * 1024 * 1024;
        private int dotFolderStarAllowance = 1000;
        private int trustedStarThreshold = 100;
        private int protectedStarThreshold = 1000;

        public int getMaxFiles() { return maxFiles; }
        public void setMaxFiles(int maxFiles) { this.maxFiles = maxFiles; }

        public long getMaxFileBytes() { return maxFileBytes; }
        public void setMaxFileBytes(long maxFileBytes) { this.maxFileBytes = maxFileBytes; }

        public long getMaxTotalBytes() { return maxTotalBytes; }
        public void setMaxTotalBytes(long maxTotalBytes) { this.maxTotalBytes = maxTotalBytes; }

        public int getDotFolderStarAllowance() { return dotFolderStarAllowance; }
        public void setDotFolderStarAllowance(int dotFolderStarAllowance) { this.dotFolderStarAllowance = dotFolderStarAllowance; }

        public int getTrustedStarThreshold() { return trustedStarThreshold; }
        public void setTrustedStarThreshold(int trustedStarThreshold) { this.trustedStarThreshold = trustedStarThreshold; }

        public int getProtectedStarThreshold() { return protectedStarThreshold; }
        public void setProtectedStarThreshold(int protectedStarThreshold) { this.protectedStarThreshold = protectedStarThreshold; }
    }

    public static class Classification {
        private int aiStarThreshold = 100;
        private int maxContentChars = 4000;
        private double temperature = 0.3;
        private int maxOutputTokens = 500;
        private String primaryModel = "meta-llama/llama-3.3-70b-instruct:free";
        private List<String> alternateModels = new ArrayList<>();
        private String secondaryModel = "deepseek-chat";
        private String openRouterBaseUrl = "https://openrouter.ai/api/v1";
        private String deepSeekBaseUrl = "https://api.deepseek.com/v1";
        private Duration requestTimeout = Duration.ofSeconds(30);

        public int getAiStarThreshold() { return aiStarThreshold; }
        public void setAiStarThreshold(int aiStarThreshold) { this.aiStarThreshold = aiStarThreshold; }

        public int getMaxContentChars() { return maxContentChars; }
        public void setMaxContentChars(int maxContentChars) { this.maxContentChars = maxContentChars; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public int getMaxOutputTokens() { return maxOutputTokens; }
        public void setMaxOutputTokens(int maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; }

        public String getPrimaryModel() { return primaryModel; }
        public void setPrimaryModel(String primaryModel) { this.primaryModel = primaryModel; }

        public List<String> getAlternateModels() { return alternateModels; }
        public void setAlternateModels(List<String> alternateModels) { this.alternateModels = alternateModels; }

        public String getSecondaryModel() { return secondaryModel; }
        public void setSecondaryModel(String secondaryModel) { this.secondaryModel = secondaryModel; }

        public String getOpenRouterBaseUrl() { return openRouterBaseUrl; }
        public void setOpenRouterBaseUrl(String openRouterBaseUrl) { this.openRouterBaseUrl = openRouterBaseUrl; }

        public String getDeepSeekBaseUrl() { return deepSeekBaseUrl; }
        public void setDeepSeekBaseUrl(String deepSeekBaseUrl) { this.deepSeekBaseUrl = deepSeekBaseUrl; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    public static class Tiers {
        private String refreshCron = "0 0 * * * *";
        private String aggregationCron = "0 15 * * * *";
        private int flaggedCap = 100;
        private int hotCap = 500;
        private int warmCap = 500;
        private int coolCap = 125;
        private int downloadRetentionDays = 35;

        public String getRefreshCron() { return refreshCron; }
        public void setRefreshCron(String refreshCron) { this.refreshCron = refreshCron; }

        public String getAggregationCron() { return aggregationCron; }
        public void setAggregationCron(String aggregationCron) { this.aggregationCron = aggregationCron; }

        public int getFlaggedCap() { return flaggedCap; }
        public void setFlaggedCap(int flaggedCap) { this.flaggedCap = flaggedCap; }

        public int getHotCap() { return hotCap; }
        public void setHotCap(int hotCap) { this.hotCap = hotCap; }

        public int getWarmCap() { return warmCap; }
        public void setWarmCap(int warmCap) { this.warmCap = warmCap; }

        public int getCoolCap() { return coolCap; }
        public void setCoolCap(int coolCap) { this.coolCap = coolCap; }

        public int getDownloadRetentionDays() { return downloadRetentionDays; }
        public void setDownloadRetentionDays(int downloadRetentionDays) { this.downloadRetentionDays = downloadRetentionDays; }
    }

    public static class Archive {
        private String cron = "0 0 3 1 * *";
        private int batchLimit = 1000;

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }

        public int getBatchLimit() { return batchLimit; }
        public void setBatchLimit(int batchLimit) { this.batchLimit = batchLimit; }
    }

    public static class Resurrection {
        private String cron = "0 0 4 1 1,4,7,10 *";
        private int batchSize = 50;
        private Duration interBatchDelay = Duration.ofMillis(1000);
        private int sweepStarThreshold = 50;
        private int onDemandStarThreshold = 20;
        private int activityWindowDays = 90;

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public Duration getInterBatchDelay() { return interBatchDelay; }
        public void setInterBatchDelay(Duration interBatchDelay) { this.interBatchDelay = interBatchDelay; }

        public int getSweepStarThreshold() { return sweepStarThreshold; }
        public void setSweepStarThreshold(int sweepStarThreshold) { this.sweepStarThreshold = sweepStarThreshold; }

        public int getOnDemandStarThreshold() { return onDemandStarThreshold; }
        public void setOnDemandStarThreshold(int onDemandStarThreshold) { this.onDemandStarThreshold = onDemandStarThreshold; }

        public int getActivityWindowDays() { return activityWindowDays; }
        public void setActivityWindowDays(int activityWindowDays) { this.activityWindowDays = activityWindowDays; }
    }

    public static class Storage {
        private String blobRoot = "data/blobs";

        public String getBlobRoot() { return blobRoot; }
        public void setBlobRoot(String blobRoot) { this.blobRoot = blobRoot; }
    }

    public static class Queue {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofSeconds(5);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private int ingestionWorkers = 2;
        private int classificationWorkers = 2;
        private Duration pollTimeout = Duration.ofSeconds(1);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

        public int getIngestionWorkers() { return ingestionWorkers; }
        public void setIngestionWorkers(int ingestionWorkers) { this.ingestionWorkers = ingestionWorkers; }

        public int getClassificationWorkers() { return classificationWorkers; }
        public void setClassificationWorkers(int classificationWorkers) { this.classificationWorkers = classificationWorkers; }

        public Duration getPollTimeout() { return pollTimeout; }
        public void setPollTimeout(Duration pollTimeout) { this.pollTimeout = pollTimeout; }
    }
}
