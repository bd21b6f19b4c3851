package com.purchasingpower.bookflow.client;

import java.util.List;

/**
 * Unified interface for generative text providers (Ollama, OpenAI-compatible).
 *
 * Implementations handle provider-specific API details.
 */
public interface LLMProvider {

    /**
     * Execute a chat completion.
     *
     * @param messages ordered role-tagged messages
     * @param temperature sampling temperature
     * @param maxTokens upper bound of generated tokens
     * @return the trimmed response text
     * @throws LLMProviderException on network or configuration problems
     */
    String chat(List<ChatMessage> messages, double temperature, int maxTokens);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
