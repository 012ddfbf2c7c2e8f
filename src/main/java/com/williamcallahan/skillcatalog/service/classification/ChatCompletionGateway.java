package com.williamcallahan.skillcatalog.service.classification;

/**
 * Single-turn chat completion against one provider.
 */
public interface ChatCompletionGateway {

    /**
     * Short provider name for logs.
     */
    String providerName();

    /**
     * Sends one user message and returns the assistant's text.
     *
     * @throws AiClassificationException when the call fails or returns no content
     */
    String complete(String model, String prompt);
}
