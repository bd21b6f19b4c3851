package com.purchasingpower.bookflow.intent;

import lombok.Value;

import java.io.Serializable;

/**
 * A catalog action with its similarity score for one query.
 */
@Value
public class ScoredCandidate implements Serializable {

    private static final long serialVersionUID = 1L;

    String name;
    double score;

    public static ScoredCandidate of(String name, double score) {
        return new ScoredCandidate(name, Math.round(score * 10_000d) / 10_000d);
    }
}
