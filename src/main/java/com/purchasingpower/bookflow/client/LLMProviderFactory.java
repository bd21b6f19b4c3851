package com.purchasingpower.bookflow.client;

import com.purchasingpower.bookflow.configuration.BookFlowProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Selects the active generative provider from {@code bookflow.llm.provider}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LLMProviderFactory {

    private final OllamaClient ollamaProvider;
    private final OpenAiClient openAiProvider;
    private final BookFlowProperties properties;

    @PostConstruct
    public void init() {
        log.info("🚀 LLM Provider configured: {}", properties.getLlm().getProvider());
        log.info("   Active provider: {}", getProvider().getProviderName());
    }

    public LLMProvider getProvider() {
        String providerName = properties.getLlm().getProvider();
        return switch (providerName.toLowerCase()) {
            case "ollama" -> ollamaProvider;
            case "openai" -> openAiProvider;
            default -> {
                log.warn("Unknown LLM provider: {}, falling back to Ollama", providerName);
                yield ollamaProvider;
            }
        };
    }
}
