package com.purchasingpower.bookflow.flow;

import org.bsc.langgraph4j.state.AgentState;

import java.util.Map;

/**
 * langgraph4j state holding the current {@link FlowState} under a single key.
 * Each node replaces the value with the next immutable state.
 */
public class FlowGraphState extends AgentState {

    public static final String FLOW = "flow";

    public FlowGraphState(Map<String, Object> initData) {
        super(initData);
    }

    public FlowState getFlow() {
        return this.<FlowState>value(FLOW)
                .orElseThrow(() -> new IllegalStateException("Flow state missing from graph state"));
    }
}
