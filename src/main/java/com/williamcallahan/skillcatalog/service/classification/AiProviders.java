package com.williamcallahan.skillcatalog.service.classification;

import java.util.Optional;

/**
 * The configured AI providers; either may be absent when its API key is not set.
 */
public class AiProviders {
    private final ChatCompletionGateway openRouter;
    private final ChatCompletionGateway deepSeek;

    public AiProviders(ChatCompletionGateway openRouter, ChatCompletionGateway deepSeek) {
        this.openRouter = openRouter;
        this.deepSeek = deepSeek;
    }

    public Optional<ChatCompletionGateway> openRouter() {
        return Optional.ofNullable(openRouter);
    }

    public Optional<ChatCompletionGateway> deepSeek() {
        return Optional.ofNullable(deepSeek);
    }

    public boolean anyAvailable() {
        return openRouter != null || deepSeek != null;
    }
}
