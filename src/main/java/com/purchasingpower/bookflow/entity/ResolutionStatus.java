package com.purchasingpower.bookflow.entity;

public enum ResolutionStatus {
    FOUND,
    AMBIGUOUS,
    NOT_FOUND
}
