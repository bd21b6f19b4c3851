package com.purchasingpower.bookflow.model.store;

public enum PaymentStatus {
    APPROVED,
    REJECTED
}
