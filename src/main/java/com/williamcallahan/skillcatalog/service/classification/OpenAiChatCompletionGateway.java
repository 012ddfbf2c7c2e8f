package com.williamcallahan.skillcatalog.service.classification;

import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;

/**
 * {@link ChatCompletionGateway} backed by the OpenAI Java SDK, usable with any
 * OpenAI-compatible endpoint.
 */
public class OpenAiChatCompletionGateway implements ChatCompletionGateway {
    private final String providerName;
    private final OpenAIClient client;
    private final double temperature;
    private final long maxOutputTokens;

    public OpenAiChatCompletionGateway(String providerName, OpenAIClient client, double temperature, long maxOutputTokens) {
        this.providerName = providerName;
        this.client = client;
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens;
    }

    @Override
    public String providerName() {
        return providerName;
    }

    @Override
    public String complete(String model, String prompt) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(model)
                .addUserMessage(prompt)
                .temperature(temperature)
                .maxCompletionTokens(maxOutputTokens)
                .build();
        ChatCompletion completion;
        try {
            completion = client.chat().completions().create(params);
        } catch (OpenAIException apiFailure) {
            throw new AiClassificationException(providerName + " call failed for " + model + ": "
                    + apiFailure.getMessage(), apiFailure);
        }
        return completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .filter(content -> !content.isBlank())
                .orElseThrow(() -> new AiClassificationException("No content in " + providerName + " response"));
    }
}
