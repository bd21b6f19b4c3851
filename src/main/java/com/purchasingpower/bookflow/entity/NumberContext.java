package com.purchasingpower.bookflow.entity;

/**
 * What a number in the query is expected to mean.
 */
public enum NumberContext {
    /** Copies to add, bounded to [1, 99]. */
    QUANTITY,
    /** Order number, only after an explicit order marker. */
    ORDER_ID,
    /** First number found. */
    ANY
}
