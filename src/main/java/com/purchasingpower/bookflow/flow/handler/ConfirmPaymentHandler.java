package com.purchasingpower.bookflow.flow.handler;

import com.purchasingpower.bookflow.flow.ActionResult;
import com.purchasingpower.bookflow.flow.ActionType;
import com.purchasingpower.bookflow.flow.FlowContext;
import com.purchasingpower.bookflow.flow.FlowContext.OrderSnapshot;
import com.purchasingpower.bookflow.flow.FlowParams;
import com.purchasingpower.bookflow.flow.FlowState;
import com.purchasingpower.bookflow.flow.PaymentSimulator;
import com.purchasingpower.bookflow.model.store.OrderStatus;
import com.purchasingpower.bookflow.model.store.Payment;
import com.purchasingpower.bookflow.model.store.PaymentStatus;
import com.purchasingpower.bookflow.model.store.PurchaseOrder;
import com.purchasingpower.bookflow.repository.PaymentRepository;
import com.purchasingpower.bookflow.repository.PurchaseOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Charges a CREATED order through the {@link PaymentSimulator}. Every attempt is
 * recorded as a payment row; only an approval moves the order to PAID.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfirmPaymentHandler implements ActionHandler {

    private final OrderContextLoader orderContextLoader;
    private final PaymentSimulator paymentSimulator;
    private final PaymentRepository paymentRepository;
    private final PurchaseOrderRepository orderRepository;

    @Override
    public ActionType actionType() {
        return ActionType.CONFIRM_PAYMENT;
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

        boolean approved = paymentSimulator.approve();
        PaymentStatus status = approved ? PaymentStatus.APPROVED : PaymentStatus.REJECTED;

        paymentRepository.save(Payment.builder()
                .orderId(order.id())
                .amount(order.total())
                .status(status)
                .build());

        PurchaseOrder stored = orderContextLoader.reload(order.id());
        stored.setStatus(approved ? OrderStatus.PAID : OrderStatus.CREATED);
        orderRepository.save(stored);

        if (approved) {
            log.info("💳 Payment approved for order #{}", order.id());
        } else {
            log.info("💳 Payment rejected for order #{}", order.id());
        }

        return ActionResult.builder()
                .success(approved)
                .paymentStatus(status)
                .orderId(order.id())
                .amount(order.total())
                .message(approved ? null
                        : String.format("El pago para la orden **#%d** fue rechazado. Intenta de nuevo.", order.id()))
                .build();
    }
}
