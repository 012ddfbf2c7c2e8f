package com.williamcallahan.skillcatalog.config;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.williamcallahan.skillcatalog.service.classification.AiProviders;
import com.williamcallahan.skillcatalog.service.classification.ChatCompletionGateway;
import com.williamcallahan.skillcatalog.service.classification.OpenAiChatCompletionGateway;
import com.williamcallahan.skillcatalog.support.OpenAiSdkUrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the OpenAI-compatible clients for the classification providers.
 * A provider whose API key is not set is left out of the chain.
 */
@Configuration
public class AiProviderConfig {
    private static final Logger log = LoggerFactory.getLogger(AiProviderConfig.class);
    static final String OPEN_ROUTER = "openrouter";
    static final String DEEP_SEEK = "deepseek";

    @Bean
    public AiProviders aiProviders(
            AppProperties appProperties,
            @Value("${OPENROUTER_API_KEY:}") String openRouterApiKey,
            @Value("${DEEPSEEK_API_KEY:}") String deepSeekApiKey) {
        AppProperties.Classification classification = appProperties.getClassification();
        AiProviders providers = new AiProviders(
                gateway(OPEN_ROUTER, openRouterApiKey, classification.getOpenRouterBaseUrl(), classification),
                gateway(DEEP_SEEK, deepSeekApiKey, classification.getDeepSeekBaseUrl(), classification));
        if (!providers.anyAvailable()) {
            log.warn("No AI provider configured; records above the AI threshold fall back to keyword classification");
        }
        return providers;
    }

    private static ChatCompletionGateway gateway(
            String providerName, String apiKey, String baseUrl, AppProperties.Classification classification) {
        if (apiKey == null || apiKey.isBlank()) {
            log.info("AI provider {} disabled: no API key", providerName);
            return null;
        }
        String normalizedBaseUrl = OpenAiSdkUrlNormalizer.normalize(baseUrl);
        OpenAIClient client = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .baseUrl(normalizedBaseUrl)
                .timeout(classification.getRequestTimeout())
                .build();
        log.info("AI provider {} initialized ({})", providerName, normalizedBaseUrl);
        return new OpenAiChatCompletionGateway(
                providerName, client, classification.getTemperature(), classification.getMaxOutputTokens());
    }
}
