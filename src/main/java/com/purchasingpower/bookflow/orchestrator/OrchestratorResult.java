package com.purchasingpower.bookflow.orchestrator;

import com.purchasingpower.bookflow.entity.BookCard;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.intent.ResolutionMethod;
import com.purchasingpower.bookflow.intent.ScoredCandidate;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything produced for one query: the reply plus how it was reached.
 */
@Value
@Builder
public class OrchestratorResult {

    String response;

    /** Null for help, guardrail and clarification replies. */
    ActionType action;

    ResolutionMethod method;
    double similarity;

    @Builder.Default
    List<String> stateTrace = List.of();

    @Builder.Default
    List<BookCard> books = List.of();

    @Builder.Default
    List<ScoredCandidate> candidates = List.of();

    public String getFunctionName() {
        return action != null ? action.getFunctionName() : "";
    }
}
