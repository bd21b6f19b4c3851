package com.purchasingpower.bookflow.flow;

import com.purchasingpower.bookflow.flow.handler.ActionHandler;
import com.purchasingpower.bookflow.service.ResponseTemplates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static com.purchasingpower.bookflow.flow.FlowStep.APPLY_ACTION;
import static com.purchasingpower.bookflow.flow.FlowStep.BUILD_RESPONSE;
import static com.purchasingpower.bookflow.flow.FlowStep.DONE;
import static com.purchasingpower.bookflow.flow.FlowStep.LOAD_CONTEXT;
import static com.purchasingpower.bookflow.flow.FlowStep.PERSIST;
import static com.purchasingpower.bookflow.flow.FlowStep.VALIDATE_INPUT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Graph routing with a stubbed handler and no database.
 */
class ActionFlowEngineRoutingTest {

    private ActionHandler handler;
    private FlowTransactions transactions;
    private ActionFlowEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        handler = mock(ActionHandler.class);
        transactions = mock(FlowTransactions.class);
        when(handler.actionType()).thenReturn(ActionType.CANCEL_ORDER);
        when(handler.normalize(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(handler.missingFields(any())).thenReturn(List.of());

        engine = new ActionFlowEngine(List.of(handler), transactions, new ResponseTemplates());
        engine.initializeGraph();
    }

    @Test
    void failedContextLoad_shouldSkipApplyAndPersist() {
        // Given
        when(handler.loadContext(any())).thenThrow(new DataAccessResourceFailureException("db unreachable"));

        // When
        FlowState state = engine.run(ActionType.CANCEL_ORDER, 5L, "cancela la orden 3",
                FlowParams.builder().orderId(3L).build());

        // Then
        assertThat(state.getStateTrace()).containsExactly(VALIDATE_INPUT, LOAD_CONTEXT, BUILD_RESPONSE, DONE);
        assertThat(state.getError()).isEqualTo("db unreachable");
        assertThat(state.getResponse()).isEqualTo("Hubo un error al procesar tu solicitud: db unreachable");
        verify(handler, never()).apply(any());
        verify(transactions, never()).begin(anyString());
        verify(transactions).release(state.getRunId());
    }

    @Test
    void loadedContext_shouldContinueThroughApplyAndPersist() {
        // Given
        when(handler.loadContext(any())).thenReturn(FlowContext.empty());
        when(handler.apply(any())).thenReturn(ActionResult.refused("La orden ya está cancelada"));

        // When
        FlowState state = engine.run(ActionType.CANCEL_ORDER, 5L, "cancela la orden 3",
                FlowParams.builder().orderId(3L).build());

        // Then
        assertThat(state.getStateTrace())
                .containsExactly(VALIDATE_INPUT, LOAD_CONTEXT, APPLY_ACTION, PERSIST, BUILD_RESPONSE, DONE);
        verify(transactions).begin(state.getRunId());
        verify(transactions).commit(state.getRunId());
    }
}
