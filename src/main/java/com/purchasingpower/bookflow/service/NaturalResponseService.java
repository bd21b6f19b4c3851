package com.purchasingpower.bookflow.service;

import com.purchasingpower.bookflow.flow.ActionType;

import java.util.Map;

/**
 * Words the result of a non-transactional action for the user.
 */
public interface NaturalResponseService {

    /**
     * Generative wording of {@code payload}; falls back to {@link ResponseTemplates}
     * when the provider fails or answers nothing. Never throws for provider problems.
     */
    String render(ActionType action, Map<String, Object> payload, String query);
}
