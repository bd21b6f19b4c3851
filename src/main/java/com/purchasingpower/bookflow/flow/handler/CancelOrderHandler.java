package com.purchasingpower.bookflow.flow.handler;

import com.purchasingpower.bookflow.flow.ActionResult;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.flow.FlowContext;
import com.purchasingpower.bookflow.flow.FlowContext.OrderSnapshot;
import com.purchasingpower.bookflow.flow.FlowParams;
import com.purchasingpower.bookflow.flow.FlowState;
import com.purchasingpower.bookflow.model.store.OrderStatus;
import com.purchasingpower.bookflow.model.store.PurchaseOrder;
import com.purchasingpower.bookflow.repository.PurchaseOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class CancelOrderHandler implements ActionHandler {

    private final OrderContextLoader orderContextLoader;
    private final PurchaseOrderRepository orderRepository;

    @Override
    public ActionType actionType() {
        return ActionType.CANCEL_ORDER;
    }

    @Override
    public List<String> missingFields(FlowParams params) {
        return params.getOrderId() == null ? List.of(FlowParams.ORDER_ID) : List.of();
    }

    @Override
    public FlowContext loadContext(FlowState state) {
        return orderContextLoader.load(state);
    }

    @Override
    public ActionResult apply(FlowState state) {
        OrderSnapshot order = state.getContext().getOrder();
        if (order == null) {
            return ActionResult.refused("Orden no encontrada");
        }
        if (order.status() == OrderStatus.PAID) {
            return ActionResult.refused(String.format(
                    "No se puede cancelar la orden **#%d** porque ya fue pagada.", order.id()));
        }
        if (order.status() == OrderStatus.CANCELLED) {
            return ActionResult.refused(String.format("La orden **#%d** ya está cancelada.", order.id()));
        }

        PurchaseOrder stored = orderContextLoader.reload(order.id());
        stored.setStatus(OrderStatus.CANCELLED);
        orderRepository.save(stored);

        log.info("🚫 Order #{} cancelled", order.id());
        return ActionResult.builder()
                .success(true)
                .orderId(order.id())
                .build();
    }
}
