package com.purchasingpower.bookflow.flow;

/**
 * States of the action flow, in the order they can be visited.
 */
public enum FlowStep {
    VALIDATE_INPUT,
    ASK_INPUT,
    LOAD_CONTEXT,
    APPLY_ACTION,
    PERSIST,
    BUILD_RESPONSE,
    DONE
}
