package com.purchasingpower.bookflow.intent;

import java.util.Locale;

/**
 * Which stage of query handling produced an {@link IntentMatch}.
 */
public enum ResolutionMethod {
    RULE,
    EMBEDDING,
    GENERATIVE_FALLBACK,
    CLARIFICATION,
    HELP,
    GUARDRAIL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
