package com.threatintel.riskengine.domain.service.evaluation;

import com.threatintel.riskengine.domain.model.ScoreFactor;
import com.threatintel.riskengine.domain.model.ScoreResult;
import com.threatintel.riskengine.domain.model.SeverityTier;
import com.threatintel.riskengine.domain.model.VendorFeatures;
import com.threatintel.riskengine.domain.service.scoring.RiskScoringService;
import com.threatintel.riskengine.domain.service.scoring.ScoringProperties;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Precision / recall of the vendor flag against labelled profiles.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VendorFlagEvaluator {

    private static final Set<String> POSITIVE_LABELS = Set.of("flagged", "watch", "high_risk");
    private static final int TOP_FACTORS = 3;

    private final RiskScoringService scoringService;
    private final ScoringProperties properties;

    /**
     * @param threshold flag threshold to evaluate; the configured one when null. Clamped to [0, 100].
     */
    public EvaluationReport evaluate(List<VendorProfileCase> cases, Double threshold) {
        double effective = threshold != null ? threshold : properties.getVendor().getFlagThreshold();
        effective = Double.isNaN(effective) ? 0.0 : Math.max(0.0, Math.min(100.0, effective));

        int tp = 0, fp = 0, fn = 0, tn = 0;
        List<CaseRow> rows = new ArrayList<>(cases.size());

        for (VendorProfileCase c : cases) {
            VendorFeatures features = c.features() != null ? c.features() : new VendorFeatures(0, 0, 0, 0, 0);
            ScoreResult result = scoringService.scoreVendor(features);

            String label = c.expectedLabel() == null ? "" : c.expectedLabel().trim().toLowerCase(Locale.ROOT);
            boolean expected = POSITIVE_LABELS.contains(label);
            boolean predicted = result.score() >= effective;

            if (predicted && expected) tp++;
            else if (predicted) fp++;
            else if (expected) fn++;
            else tn++;

            rows.add(CaseRow.builder()
                    .profileId(c.profileId())
                    .vendorName(c.vendorName())
                    .expectedLabel(label.isEmpty() ? "unknown" : label)
                    .expectedPositive(expected)
                    .predictedPositive(predicted)
                    .score(result.score())
                    .tier(result.tier())
                    .topFactors(result.factors().stream().limit(TOP_FACTORS).toList())
                    .build());
        }

        double precision = tp + fp > 0 ? (double) tp / (tp + fp) : 0.0;
        double recall = tp + fn > 0 ? (double) tp / (tp + fn) : 0.0;
        double f1 = precision + recall > 0 ? 2.0 * precision * recall / (precision + recall) : 0.0;

        log.info("[Vendor-Eval] cases={}, threshold={}, tp={}, fp={}, fn={}, tn={}, f1={}",
                cases.size(), effective, tp, fp, fn, tn, String.format(Locale.ROOT, "%.4f", f1));

        return EvaluationReport.builder()
                .threshold(effective)
                .casesTotal(cases.size())
                .truePositives(tp)
                .falsePositives(fp)
                .falseNegatives(fn)
                .trueNegatives(tn)
                .precision(round4(precision))
                .recall(round4(recall))
                .f1(round4(f1))
                .cases(rows)
                .build();
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    @Getter
    @Builder
    public static class EvaluationReport {
        private final double threshold;
        private final int casesTotal;
        private final int truePositives;
        private final int falsePositives;
        private final int falseNegatives;
        private final int trueNegatives;
        private final double precision;
        private final double recall;
        private final double f1;
        private final List<CaseRow> cases;
    }

    @Getter
    @Builder
    public static class CaseRow {
        private final String profileId;
        private final String vendorName;
        private final String expectedLabel;
        private final boolean expectedPositive;
        private final boolean predictedPositive;
        private final double score;
        private final SeverityTier tier;
        private final List<ScoreFactor> topFactors;
    }
}
