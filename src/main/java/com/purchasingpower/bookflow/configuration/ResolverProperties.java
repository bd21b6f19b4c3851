package com.purchasingpower.bookflow.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

/**
 * Thresholds of the embedding tier of intent resolution.
 */
@Data
public class ResolverProperties {

    /** Base threshold when the catalog has per-example vectors. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.45;

    /** Base threshold when only combined vectors exist. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double combinedSimilarityThreshold = 0.30;

    /** Gap to the runner-up that is reported as low; never blocks acceptance. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceGapThreshold = 0.05;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double highConfidenceThreshold = 0.65;

    /** Lowest top score that still asks the generative classifier. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double generativeFallbackFloor = 0.25;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double exampleWeight = 0.6;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double descriptionWeight = 0.4;

    private int maxCandidates = 3;
}
