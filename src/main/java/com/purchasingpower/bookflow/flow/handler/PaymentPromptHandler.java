package com.purchasingpower.bookflow.flow.handler;

import com.purchasingpower.bookflow.flow.ActionResult;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.flow.FlowContext;
import com.purchasingpower.bookflow.flow.FlowContext.OrderSnapshot;
import com.purchasingpower.bookflow.flow.FlowParams;
import com.purchasingpower.bookflow.flow.FlowState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * First step of paying: checks the order and asks the user to confirm.
 * Nothing is charged here.
 */
@Component
@RequiredArgsConstructor
public class PaymentPromptHandler implements ActionHandler {

    private final OrderContextLoader orderContextLoader;

    @Override
    public ActionType actionType() {
        return ActionType.PROCESS_PAYMENT;
    }

    @Override
    public List<String> missingFields(FlowParams params) {
        return List.of();
    }

    @Override
    public FlowContext loadContext(FlowState state) {
        return orderContextLoader.load(state);
    }

    @Override
    public ActionResult apply(FlowState state) {
        OrderSnapshot order = state.getContext().getOrder();
        Optional<String> refusal = Payability.refusal(order);
        if (refusal.isPresent()) {
            return ActionResult.refused(refusal.get());
        }

        return ActionResult.builder()
                .success(true)
                .needsConfirmation(true)
                .orderId(order.id())
                .amount(order.total())
                .build();
    }
}
