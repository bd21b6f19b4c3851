package com.purchasingpower.bookflow.intent;

import com.purchasingpower.bookflow.flow.ActionType;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of intent resolution for one query. Immutable.
 */
@Value
@Builder
public class IntentMatch {

    /** Resolved action, null when nothing matched. */
    ActionType action;

    /** Confidence in [0, 1]: 1.0 for rules, the best similarity score otherwise. */
    double confidence;

    ResolutionMethod method;

    @Builder.Default
    List<ScoredCandidate> candidates = List.of();

    public boolean isResolved() {
        return action != null;
    }

    public static IntentMatch rule(ActionType action) {
        return IntentMatch.builder()
                .action(action)
                .confidence(1.0)
                .method(ResolutionMethod.RULE)
                .candidates(List.of(ScoredCandidate.of(action.getFunctionName(), 1.0)))
                .build();
    }

    public static IntentMatch clarification(double bestScore, List<ScoredCandidate> candidates) {
        return IntentMatch.builder()
                .confidence(bestScore)
                .method(ResolutionMethod.CLARIFICATION)
                .candidates(List.copyOf(candidates))
                .build();
    }
}
