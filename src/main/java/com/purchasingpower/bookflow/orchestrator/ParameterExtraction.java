package com.purchasingpower.bookflow.orchestrator;

import com.purchasingpower.bookflow.entity.EntityResolution;
import com.purchasingpower.bookflow.flow.FlowParams;
import lombok.Value;

/**
 * Parameters extracted for one action, plus the book resolution outcome when
 * the action refers to a book.
 */
@Value
public class ParameterExtraction {

    FlowParams params;

    /** Null for actions that do not refer to a book. */
    EntityResolution bookResolution;
}
