package com.purchasingpower.bookflow.flow.handler;

import com.purchasingpower.bookflow.flow.ActionResult;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.flow.FlowContext;
import com.purchasingpower.bookflow.flow.FlowParams;
import com.purchasingpower.bookflow.flow.FlowState;

import java.util.List;

/**
 * Business logic of one flow-based action. The engine calls the methods in
 * step order: {@link #normalize} and {@link #missingFields} in VALIDATE_INPUT,
 * {@link #loadContext} in LOAD_CONTEXT, {@link #apply} inside the workflow
 * transaction in APPLY_ACTION.
 */
public interface ActionHandler {

    ActionType actionType();

    /**
     * Fill defaults for optional parameters.
     */
    default FlowParams normalize(FlowParams params) {
        return params;
    }

    /**
     * Names of required parameters that are absent, in the order they are asked for.
     */
    List<String> missingFields(FlowParams params);

    /**
     * Read-only: must not modify storage.
     */
    FlowContext loadContext(FlowState state);

    /**
     * Perform the mutation. Business refusals are returned as unsuccessful results;
     * exceptions roll the workflow transaction back.
     */
    ActionResult apply(FlowState state);
}
