package com.purchasingpower.bookflow.model.catalog;

public enum EmbeddingType {
    DESCRIPTION,
    EXAMPLE
}
