package com.purchasingpower.bookflow.flow.handler;

import com.purchasingpower.bookflow.flow.FlowContext;
import com.purchasingpower.bookflow.flow.FlowState;
import com.purchasingpower.bookflow.model.store.OrderStatus;
import com.purchasingpower.bookflow.model.store.PurchaseOrder;
import com.purchasingpower.bookflow.repository.PurchaseOrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Loads the order an order action targets: the given order of the user, or the
 * user's most recent order still waiting for payment.
 */
@Component
@RequiredArgsConstructor
public class OrderContextLoader {

    private final PurchaseOrderRepository orderRepository;

    public FlowContext load(FlowState state) {
        Long orderId = state.getParams().getOrderId();
        Optional<PurchaseOrder> order = orderId != null
                ? orderRepository.findByIdAndUserId(orderId, state.getUserId())
                : orderRepository.findFirstByUserIdAndStatusOrderByIdDesc(state.getUserId(), OrderStatus.CREATED);

        return FlowContext.builder()
                .order(order.map(o -> new FlowContext.OrderSnapshot(o.getId(), o.getStatus(), o.getTotal()))
                        .orElse(null))
                .build();
    }

    public PurchaseOrder reload(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new IllegalStateException("Order " + orderId + " disappeared during the flow"));
    }
}
