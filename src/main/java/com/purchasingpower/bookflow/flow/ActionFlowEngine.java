package com.purchasingpower.bookflow.flow;

import com.purchasingpower.bookflow.flow.handler.ActionHandler;
import com.purchasingpower.bookflow.service.ResponseTemplates;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Runs flow-based actions through a fixed state graph:
 *
 * <pre>
 * VALIDATE_INPUT -> (ASK_INPUT | LOAD_CONTEXT) -> (APPLY_ACTION | -) -> (PERSIST | -) -> BUILD_RESPONSE -> DONE
 * </pre>
 *
 * ASK_INPUT is the only path that never touches storage. A failed LOAD_CONTEXT
 * goes straight to BUILD_RESPONSE. APPLY_ACTION opens the workflow transaction,
 * PERSIST commits it and a failed apply rolls it back and skips PERSIST.
 */
@Slf4j
@Component
public class ActionFlowEngine {

    private static final String NEEDS_INPUT = "needs_input";
    private static final String VALID = "valid";
    private static final String FAILED = "error";
    private static final String APPLIED = "success";

    private final Map<ActionType, ActionHandler> handlers = new EnumMap<>(ActionType.class);
    private final FlowTransactions transactions;
    private final ResponseTemplates templates;

    private CompiledGraph<FlowGraphState> compiledGraph;

    public ActionFlowEngine(List<ActionHandler> handlers, FlowTransactions transactions, ResponseTemplates templates) {
        for (ActionHandler handler : handlers) {
            ActionHandler previous = this.handlers.put(handler.actionType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for " + handler.actionType());
            }
        }
        this.transactions = transactions;
        this.templates = templates;
    }

    @PostConstruct
    public void initializeGraph() throws GraphStateException {
        log.info("🚀 Initializing action flow graph with {} handlers", handlers.size());
        StateGraph<FlowGraphState> graph = new StateGraph<>(FlowGraphState::new);

        graph.addNode(FlowStep.VALIDATE_INPUT.name(), step(this::validateInput));
        graph.addNode(FlowStep.ASK_INPUT.name(), step(this::askInput));
        graph.addNode(FlowStep.LOAD_CONTEXT.name(), step(this::loadContext));
        graph.addNode(FlowStep.APPLY_ACTION.name(), step(this::applyAction));
        graph.addNode(FlowStep.PERSIST.name(), step(this::persist));
        graph.addNode(FlowStep.BUILD_RESPONSE.name(), step(this::buildResponse));
        graph.addNode(FlowStep.DONE.name(), step(s -> s.visit(FlowStep.DONE)));

        graph.addEdge(START, FlowStep.VALIDATE_INPUT.name());

        graph.addConditionalEdges(FlowStep.VALIDATE_INPUT.name(),
                edge_async(s -> s.getFlow().isNeedsInput() ? NEEDS_INPUT : VALID),
                Map.of(NEEDS_INPUT, FlowStep.ASK_INPUT.name(), VALID, FlowStep.LOAD_CONTEXT.name()));

        graph.addEdge(FlowStep.ASK_INPUT.name(), FlowStep.DONE.name());
        graph.addConditionalEdges(FlowStep.LOAD_CONTEXT.name(),
                edge_async(s -> s.getFlow().hasError() ? FAILED : VALID),
                Map.of(FAILED, FlowStep.BUILD_RESPONSE.name(), VALID, FlowStep.APPLY_ACTION.name()));

        graph.addConditionalEdges(FlowStep.APPLY_ACTION.name(),
                edge_async(s -> s.getFlow().hasError() ? FAILED : APPLIED),
                Map.of(FAILED, FlowStep.BUILD_RESPONSE.name(), APPLIED, FlowStep.PERSIST.name()));

        graph.addEdge(FlowStep.PERSIST.name(), FlowStep.BUILD_RESPONSE.name());
        graph.addEdge(FlowStep.BUILD_RESPONSE.name(), FlowStep.DONE.name());
        graph.addEdge(FlowStep.DONE.name(), END);

        this.compiledGraph = graph.compile();
    }

    public boolean supports(ActionType action) {
        return handlers.containsKey(action);
    }

    /**
     * Execute one flow. Always returns a final state with a response; failures
     * show up in {@link FlowState#getError()}.
     */
    public FlowState run(ActionType action, Long userId, String query, FlowParams params) {
        if (!supports(action)) {
            throw new IllegalArgumentException("No flow handler for " + action);
        }

        FlowState initial = FlowState.builder()
                .runId(UUID.randomUUID().toString())
                .userId(userId)
                .action(action)
                .query(query)
                .params(params != null ? params : FlowParams.empty())
                .build();

        log.info("🔵 Flow {} started for {} (user {})", initial.getRunId(), action.getFunctionName(), userId);
        Map<String, Object> initialData = new HashMap<>();
        initialData.put(FlowGraphState.FLOW, initial);

        try {
            Optional<FlowGraphState> result = compiledGraph.invoke(initialData);
            FlowState finalState = result.map(FlowGraphState::getFlow).orElse(initial);
            log.info("🟢 Flow {} finished: {}", initial.getRunId(), String.join(" → ", finalState.traceNames()));
            return finalState;
        } catch (Exception e) {
            log.error("🔴 Flow {} failed outside its steps", initial.getRunId(), e);
            return initial.toBuilder()
                    .error(e.getMessage())
                    .response(templates.error(String.valueOf(e.getMessage())))
                    .build();
        } finally {
            transactions.release(initial.getRunId());
        }
    }

    FlowState validateInput(FlowState state) {
        ActionHandler handler = handlers.get(state.getAction());
        FlowParams params = handler.normalize(state.getParams());
        List<String> missing = List.copyOf(handler.missingFields(params));
        if (!missing.isEmpty()) {
            log.info("Missing input for {}: {}", state.getAction().getFunctionName(), missing);
        }
        return state.visit(FlowStep.VALIDATE_INPUT).toBuilder()
                .params(params)
                .needsInput(!missing.isEmpty())
                .missingFields(missing)
                .build();
    }

    FlowState askInput(FlowState state) {
        return state.visit(FlowStep.ASK_INPUT).toBuilder()
                .response(templates.missingInput(state.getMissingFields()))
                .build();
    }

    FlowState loadContext(FlowState state) {
        FlowState visited = state.visit(FlowStep.LOAD_CONTEXT);
        try {
            FlowContext context = handlers.get(state.getAction()).loadContext(visited);
            return visited.toBuilder().context(context).build();
        } catch (RuntimeException e) {
            log.error("🔴 Loading context for {} failed: {}", state.getAction().getFunctionName(), e.getMessage(), e);
            return visited.toBuilder().error(e.getMessage()).build();
        }
    }

    FlowState applyAction(FlowState state) {
        FlowState visited = state.visit(FlowStep.APPLY_ACTION);
        String runId = visited.getRunId();
        try {
            transactions.begin(runId);
            ActionResult result = handlers.get(state.getAction()).apply(visited);
            log.info("✅ Applied {} (success={})", state.getAction().getFunctionName(), result.isSuccess());
            return visited.toBuilder().actionResult(result).build();
        } catch (RuntimeException e) {
            log.error("🔴 Action {} failed: {}", state.getAction().getFunctionName(), e.getMessage(), e);
            transactions.rollback(runId);
            return visited.toBuilder()
                    .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }

    FlowState persist(FlowState state) {
        FlowState visited = state.visit(FlowStep.PERSIST);
        try {
            transactions.commit(visited.getRunId());
            log.info("💾 Flow {} committed", visited.getRunId());
            return visited;
        } catch (RuntimeException e) {
            log.error("🔴 Commit of flow {} failed: {}", visited.getRunId(), e.getMessage(), e);
            transactions.rollback(visited.getRunId());
            return visited.toBuilder().persistenceFailed(true).build();
        }
    }

    FlowState buildResponse(FlowState state) {
        FlowState visited = state.visit(FlowStep.BUILD_RESPONSE);
        String response;
        if (visited.hasError()) {
            response = templates.error(visited.getError());
        } else {
            response = templates.forFlow(visited.getAction(), visited.getActionResult());
            if (visited.isPersistenceFailed()) {
                response = templates.persistenceNotConfirmed(response);
            }
        }
        return visited.toBuilder().response(response).build();
    }

    private static AsyncNodeAction<FlowGraphState> step(Function<FlowState, FlowState> transition) {
        return node_async(s -> {
            Map<String, Object> updates = new HashMap<>();
            updates.put(FlowGraphState.FLOW, transition.apply(s.getFlow()));
            return updates;
        });
    }
}
