package com.purchasingpower.bookflow.service.impl;

import com.purchasingpower.bookflow.client.ChatMessage;
import com.purchasingpower.bookflow.client.FailureKind;
import com.purchasingpower.bookflow.client.LLMProvider;
import com.purchasingpower.bookflow.client.LLMProviderException;
import com.purchasingpower.bookflow.client.LLMProviderFactory;
import com.purchasingpower.bookflow.client.ProviderResult;
import com.purchasingpower.bookflow.service.GenerativeTextService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GenerativeTextServiceImpl implements GenerativeTextService {

    private final LLMProviderFactory providerFactory;

    @Override
    public ProviderResult<String> complete(List<ChatMessage> messages, double temperature, int maxTokens) {
        LLMProvider provider = providerFactory.getProvider();
        try {
            return ProviderResult.success(provider.chat(messages, temperature, maxTokens));
        } catch (LLMProviderException e) {
            log.warn("⚠️ {} failed ({}): {}", provider.getProviderName(), e.getKind(), e.getMessage());
            return ProviderResult.failure(e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("⚠️ {} failed unexpectedly: {}", provider.getProviderName(), e.getMessage());
            return ProviderResult.failure(FailureKind.UNAVAILABLE, e.getMessage());
        }
    }
}
