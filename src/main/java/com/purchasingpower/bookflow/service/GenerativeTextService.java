package com.purchasingpower.bookflow.service;

import com.purchasingpower.bookflow.client.ChatMessage;
import com.purchasingpower.bookflow.client.ProviderResult;

import java.util.List;

/**
 * Calls the active generative provider and turns every failure into a
 * {@link ProviderResult} instead of an exception.
 */
public interface GenerativeTextService {

    ProviderResult<String> complete(List<ChatMessage> messages, double temperature, int maxTokens);
}
