package com.threatintel.riskengine.domain.model;

/**
 * Spread of a general-risk score under input jitter.
 *
 * @param pointScore score of the unperturbed inputs
 * @param samples    number of simulated scores
 * @param std        population standard deviation
 */
public record ScoreUncertainty(
        double pointScore,
        int samples,
        double mean,
        double std,
        double p05,
        double p50,
        double p95
) {
}
