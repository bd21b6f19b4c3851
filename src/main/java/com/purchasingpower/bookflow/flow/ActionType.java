package com.purchasingpower.bookflow.flow;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of store actions the assistant can execute.
 *
 * <p>Each constant carries its catalog function name, whether it runs through
 * the {@link ActionFlowEngine} and whether its reply comes from fixed templates
 * instead of the generative provider.
 */
public enum ActionType {

    SEARCH_BOOKS_FOR_SALE("search_books_for_sale", false, false),
    RECOMMEND_BOOKS_FOR_PURCHASE("recommend_books_for_purchase", false, false),
    GET_BOOK_PRODUCT_DETAILS("get_book_product_details", false, false),
    CHECK_BOOK_STOCK("check_book_stock", false, false),
    ADD_BOOK_TO_CART("add_book_to_cart", true, true),
    REMOVE_BOOK_FROM_CART("remove_book_from_cart", true, true),
    CHECKOUT_ORDER("checkout_order", true, true),
    PROCESS_PAYMENT("process_payment", true, true),
    CONFIRM_PAYMENT("confirm_payment", true, true),
    CANCEL_ORDER("cancel_order", true, true),
    GET_ORDER_STATUS("get_order_status", false, false),
    VIEW_CART("view_cart", false, true);

    private final String functionName;
    private final boolean flowBased;
    private final boolean transactional;

    ActionType(String functionName, boolean flowBased, boolean transactional) {
        this.functionName = functionName;
        this.flowBased = flowBased;
        this.transactional = transactional;
    }

    public String getFunctionName() {
        return functionName;
    }

    public boolean isFlowBased() {
        return flowBased;
    }

    /**
     * Replies for these actions are rendered by templates only.
     */
    public boolean isTransactional() {
        return transactional;
    }

    /**
     * Actions that refer to one specific book of the catalog.
     */
    public boolean referencesBook() {
        return this == ADD_BOOK_TO_CART || this == REMOVE_BOOK_FROM_CART
                || this == GET_BOOK_PRODUCT_DETAILS || this == CHECK_BOOK_STOCK;
    }

    public boolean mutatesCart() {
        return this == ADD_BOOK_TO_CART || this == REMOVE_BOOK_FROM_CART;
    }

    public boolean referencesOrder() {
        return this == PROCESS_PAYMENT || this == CONFIRM_PAYMENT
                || this == CANCEL_ORDER || this == GET_ORDER_STATUS;
    }

    public static Optional<ActionType> fromFunctionName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(a -> a.functionName.equals(trimmed))
                .findFirst();
    }
}
