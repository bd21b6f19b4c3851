package com.purchasingpower.bookflow.flow;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;

/**
 * Parameters extracted from the query for one action. Absent values are null.
 */
@Value
@Builder(toBuilder = true)
public class FlowParams implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String BOOK_ID = "book_id";
    public static final String ORDER_ID = "order_id";
    public static final String QUANTITY = "quantity";

    Long bookId;
    Integer quantity;
    Long orderId;

    public static FlowParams empty() {
        return FlowParams.builder().build();
    }
}
