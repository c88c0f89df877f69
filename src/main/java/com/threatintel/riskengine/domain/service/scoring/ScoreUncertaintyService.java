package com.threatintel.riskengine.domain.service.scoring;

import com.threatintel.riskengine.domain.model.ExternalSignalFeatures;
import com.threatintel.riskengine.domain.model.RecordFeatures;
import com.threatintel.riskengine.domain.model.ScoreUncertainty;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.model.SourceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.SplittableRandom;

/**
 * Monte Carlo interval around a general-risk score.
 * <p>
 * Each sample perturbs the four inputs independently: keyword weight and frequency factor
 * from truncated normals, source credibility from a Beta centred on the point value, and
 * the recency decay from a truncated normal around the point decay.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoreUncertaintyService {

    private static final double MIN_BETA_SHAPE = 0.01;
    private static final double MIN_SIGMA = 0.001;

    private final RiskScoringService scoringService;
    private final ScoringProperties properties;

    public ScoreUncertainty simulate(SignalRecord record, Integer sampleCount, Long seed) {
        RecordFeatures features = record.getFeatures();
        if (record.resolvedSourceType() != SourceType.EXTERNAL_SIGNAL
                || !(features instanceof ExternalSignalFeatures general)) {
            throw new IllegalArgumentException(
                    "score uncertainty needs an external signal with its feature payload: " + record.getId());
        }
        return simulate(general, sampleCount, seed);
    }

    public ScoreUncertainty simulate(ExternalSignalFeatures features) {
        return simulate(features, null, null);
    }

    /**
     * @param sampleCount samples to draw; the configured count when null, never below the configured minimum
     * @param seed        overrides the configured seed when not null
     */
    public ScoreUncertainty simulate(ExternalSignalFeatures features, Integer sampleCount, Long seed) {
        ScoringProperties.Uncertainty u = properties.getUncertainty();
        ScoringProperties.General g = properties.getGeneral();

        int n = Math.max(u.getMinSampleCount(), sampleCount != null ? sampleCount : u.getSampleCount());
        Long effectiveSeed = seed != null ? seed : u.getSeed();
        SplittableRandom rng = effectiveSeed != null ? new SplittableRandom(effectiveSeed) : new SplittableRandom();

        double baseWeight = positiveOr(features.keywordWeight(), 1.0);
        double baseFrequency = clamp(positiveOr(features.frequencyFactor(), 1.0),
                g.getMinFrequencyFactor(), g.getMaxFrequencyFactor());
        double baseCredibility = clamp(features.sourceCredibility(), 0.0, 1.0);
        double baseDecay = scoringService.recencyDecay(features.recencyHours());

        double weightSigma = Math.max(u.getMinKeywordWeightSigma(), u.getKeywordWeightSigmaRatio() * baseWeight);
        double alpha = Math.max(MIN_BETA_SHAPE, baseCredibility * u.getCredibilityConcentration());
        double beta = Math.max(MIN_BETA_SHAPE, (1.0 - baseCredibility) * u.getCredibilityConcentration());

        long startNano = System.nanoTime();
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            double weight = truncatedNormal(rng, baseWeight, weightSigma,
                    u.getMinKeywordWeight(), g.getMaxKeywordWeight(), u.getMaxTruncationAttempts());
            double credibility = sampleBeta(alpha, beta, rng);
            double frequency = truncatedNormal(rng, baseFrequency, u.getFrequencySigma(),
                    g.getMinFrequencyFactor(), g.getMaxFrequencyFactor(), u.getMaxTruncationAttempts());
            double decay = truncatedNormal(rng, baseDecay, u.getRecencySigma(),
                    g.getRecencyFloor(), 1.0, u.getMaxTruncationAttempts());
            scores[i] = scoringService.generalScore(weight, frequency, credibility, decay);
        }
        Arrays.sort(scores);

        double mean = Arrays.stream(scores).average().orElse(0.0);
        double variance = Arrays.stream(scores).map(s -> (s - mean) * (s - mean)).sum() / n;
        double pointScore = scoringService.scoreGeneral(features).score();

        ScoreUncertainty result = new ScoreUncertainty(pointScore, n,
                round3(mean), round3(Math.sqrt(variance)),
                round3(percentile(scores, 0.05)), round3(percentile(scores, 0.50)), round3(percentile(scores, 0.95)));

        log.debug("[Uncertainty] point={}, samples={}, seed={}, mean={}, p05={}, p95={}, elapsed={}us",
                pointScore, n, effectiveSeed, result.mean(), result.p05(), result.p95(),
                (System.nanoTime() - startNano) / 1_000);
        return result;
    }

    /** Linear interpolation between the closest ranks of an ascending array. */
    static double percentile(double[] sorted, double quantile) {
        if (sorted.length == 0) return 0.0;
        if (quantile <= 0) return sorted[0];
        if (quantile >= 1) return sorted[sorted.length - 1];

        double idx = (sorted.length - 1) * quantile;
        int lower = (int) Math.floor(idx);
        int upper = (int) Math.ceil(idx);
        if (lower == upper) return sorted[lower];
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (idx - lower);
    }

    /** Rejection sampling; falls back to the clamped last draw after maxAttempts. */
    static double truncatedNormal(SplittableRandom rng, double mean, double sigma,
                                  double lower, double upper, int maxAttempts) {
        double sd = Math.max(sigma, MIN_SIGMA);
        double value = mean;
        for (int i = 0; i < Math.max(1, maxAttempts); i++) {
            value = mean + sd * rng.nextGaussian();
            if (value >= lower && value <= upper) return value;
        }
        return clamp(value, lower, upper);
    }

    static double sampleBeta(double alpha, double beta, SplittableRandom rng) {
        double x = sampleGamma(alpha, rng);
        double y = sampleGamma(beta, rng);
        double sum = x + y;
        return sum > 0 ? x / sum : alpha / (alpha + beta);
    }

    // Marsaglia-Tsang; shapes below 1 are boosted by one and scaled back with U^(1/shape).
    private static double sampleGamma(double shape, SplittableRandom rng) {
        if (shape < 1.0) {
            return sampleGamma(shape + 1.0, rng) * Math.pow(rng.nextDouble(), 1.0 / shape);
        }
        double d = shape - 1.0 / 3.0;
        double c = 1.0 / Math.sqrt(9.0 * d);
        while (true) {
            double z = rng.nextGaussian();
            double v = 1.0 + c * z;
            if (v <= 0) continue;
            v = v * v * v;
            double u = rng.nextDouble();
            if (Math.log(u) < 0.5 * z * z + d - d * v + d * Math.log(v)) {
                return d * v;
            }
        }
    }

    private static double positiveOr(double value, double fallback) {
        return Double.isNaN(value) || value <= 0 ? fallback : value;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }

    private static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
