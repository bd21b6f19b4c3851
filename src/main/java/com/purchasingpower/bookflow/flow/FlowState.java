package com.purchasingpower.bookflow.flow;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable state of one action flow. Every step returns a new instance; the
 * trace only ever grows.
 */
@Value
@Builder(toBuilder = true)
public class FlowState implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Identifies the workflow transaction of this run. */
    String runId;

    Long userId;
    ActionType action;
    String query;

    @Builder.Default
    FlowParams params = FlowParams.empty();

    @Builder.Default
    FlowContext context = FlowContext.empty();

    ActionResult actionResult;
    String response;

    @Builder.Default
    List<FlowStep> stateTrace = List.of();

    boolean needsInput;

    @Builder.Default
    List<String> missingFields = List.of();

    String error;

    /** Commit of the workflow transaction failed; the changes were rolled back. */
    boolean persistenceFailed;

    /**
     * Copy of this state with {@code step} appended to the trace.
     */
    public FlowState visit(FlowStep step) {
        List<FlowStep> trace = new ArrayList<>(stateTrace);
        trace.add(step);
        return toBuilder().stateTrace(List.copyOf(trace)).build();
    }

    public boolean hasError() {
        return error != null;
    }

    public List<String> traceNames() {
        return stateTrace.stream().map(Enum::name).toList();
    }
}
