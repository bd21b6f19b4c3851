package com.purchasingpower.bookflow.model.store;

/**
 * Order lifecycle: CREATED moves once to PAID or CANCELLED, both terminal.
 */
public enum OrderStatus {
    CREATED,
    PAID,
    CANCELLED;

    public boolean isTerminal() {
        return this != CREATED;
    }

    /**
     * Lower-case label shown to users and stored in audit payloads.
     */
    public String label() {
        return name().toLowerCase();
    }
}
