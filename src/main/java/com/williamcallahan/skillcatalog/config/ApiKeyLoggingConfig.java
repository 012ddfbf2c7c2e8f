package com.williamcallahan.skillcatalog.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ApiKeyLoggingConfig {
    private static final Logger logger = LoggerFactory.getLogger(ApiKeyLoggingConfig.class);

    @Value("${GITHUB_TOKEN:}")
    private String githubToken;

    @Value("${OPENROUTER_API_KEY:}")
    private String openRouterApiKey;

    @Value("${DEEPSEEK_API_KEY:}")
    private String deepSeekApiKey;

    @Value("${spring.profiles.active:dev}")
    private String activeProfile;

    @PostConstruct
    public void logApiKeyStatus() {
        logger.info("=== API Key Configuration Status ===");

        boolean isDev = "dev".equalsIgnoreCase(activeProfile);
        logApiKey("GITHUB_TOKEN", githubToken, isDev);
        logApiKey("OPENROUTER_API_KEY", openRouterApiKey, isDev);
        logApiKey("DEEPSEEK_API_KEY", deepSeekApiKey, isDev);

        if (!hasValue(githubToken)) {
            logger.warn("Metadata: unauthenticated REST only, batch refreshes will see no data");
        }
        if (hasValue(openRouterApiKey) && hasValue(deepSeekApiKey)) {
            logger.info("Classification: OpenRouter with DeepSeek fallback");
        } else if (hasValue(openRouterApiKey)) {
            logger.info("Classification: OpenRouter only");
        } else if (hasValue(deepSeekApiKey)) {
            logger.info("Classification: DeepSeek only");
        } else {
            logger.warn("Classification: no AI key configured, keyword classification only");
        }

        logger.info("===================================");
    }

    private void logApiKey(String keyName, String keyValue, boolean isDev) {
        if (!hasValue(keyValue)) {
            logger.info("{}: Not configured", keyName);
        } else if (isDev) {
            logger.info("{}: Configured (***{})", keyName, maskApiKey(keyValue, 4));
        } else {
            logger.info("{}: Configured", keyName);
        }
    }

    private boolean hasValue(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private String maskApiKey(String key, int visibleChars) {
        if (key == null || key.length() <= visibleChars) {
            return "****";
        }
        return key.substring(key.length() - visibleChars);
    }
}
