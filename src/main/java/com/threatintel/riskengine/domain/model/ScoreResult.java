package com.threatintel.riskengine.domain.model;

import java.util.List;

/**
 * Output of a single-record scoring function.
 *
 * @param score     clamped to [0, 100]
 * @param factors   material contributors, strongest first
 * @param flagged   vendor flag state; always false for the other dimensions
 * @param scorable  false when the record carried no usable feature payload
 */
public record ScoreResult(
        ScoreDimension dimension,
        double score,
        SeverityTier tier,
        List<ScoreFactor> factors,
        boolean flagged,
        boolean scorable
) {

    public static ScoreResult unscorable(ScoreDimension dimension) {
        return new ScoreResult(dimension, 0.0, SeverityTier.LOW, List.of(), false, false);
    }
}
