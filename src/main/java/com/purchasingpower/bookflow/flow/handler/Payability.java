package com.purchasingpower.bookflow.flow.handler;

import com.purchasingpower.bookflow.flow.FlowContext.OrderSnapshot;
import com.purchasingpower.bookflow.model.store.OrderStatus;

import java.util.Optional;

/**
 * Shared payment preconditions of the prompt and confirmation steps.
 */
final class Payability {

    static final String NO_PENDING_ORDER =
            "No se encontró una orden pendiente de pago. Primero haz checkout de tu carrito.";

    private Payability() {
    }

    /**
     * @return the refusal message, or empty when the order can be paid
     */
    static Optional<String> refusal(OrderSnapshot order) {
        if (order == null) {
            return Optional.of(NO_PENDING_ORDER);
        }
        if (order.status() == OrderStatus.PAID) {
            return Optional.of(String.format("La orden **#%d** ya fue pagada anteriormente.", order.id()));
        }
        if (order.status() == OrderStatus.CANCELLED) {
            return Optional.of(String.format("La orden **#%d** fue cancelada y no se puede pagar.", order.id()));
        }
        if (order.status() != OrderStatus.CREATED) {
            return Optional.of(String.format("La orden **#%d** está en estado '%s' y no se puede pagar.",
                    order.id(), order.status().label()));
        }
        return Optional.empty();
    }
}
