package com.purchasingpower.bookflow.flow;

import com.purchasingpower.bookflow.model.store.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.util.List;

/**
 * Read-only snapshot of the rows an action needs, captured by LOAD_CONTEXT.
 * Entities are not kept in flow state; APPLY_ACTION re-reads what it mutates.
 */
@Value
@Builder
public class FlowContext implements Serializable {

    private static final long serialVersionUID = 1L;

    BookSnapshot book;

    /** Active cart of the user, null when there is none yet. */
    Long cartId;

    @Builder.Default
    List<CartLine> cartLines = List.of();

    OrderSnapshot order;

    public static FlowContext empty() {
        return FlowContext.builder().build();
    }

    public record BookSnapshot(Long id, String title, double price, int stock) implements Serializable {
    }

    public record CartLine(Long bookId, String title, double price, int quantity) implements Serializable {
    }

    public record OrderSnapshot(Long id, OrderStatus status, double total) implements Serializable {
    }
}
