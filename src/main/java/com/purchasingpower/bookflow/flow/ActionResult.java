package com.purchasingpower.bookflow.flow;

import com.purchasingpower.bookflow.model.store.PaymentStatus;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * Outcome of APPLY_ACTION. Business refusals (no stock, wrong order status,
 * empty cart) are unsuccessful results with a user-facing message, not errors.
 */
@Value
@Builder
public class ActionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    boolean success;

    /** User-facing explanation, set for refusals. */
    String message;

    /** Payment prompt: nothing was charged, the user must confirm. */
    boolean needsConfirmation;

    String bookTitle;
    int quantity;
    Long cartId;

    Long orderId;
    double amount;
    double total;
    int itemsCount;

    PaymentStatus paymentStatus;

    public static ActionResult refused(String message) {
        return ActionResult.builder().success(false).message(message).build();
    }
}
