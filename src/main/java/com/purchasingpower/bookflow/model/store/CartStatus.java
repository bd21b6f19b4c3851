package com.purchasingpower.bookflow.model.store;

/**
 * Lifecycle of a shopping cart. A user has at most one ACTIVE cart.
 */
public enum CartStatus {
    ACTIVE,
    CHECKED_OUT
}
