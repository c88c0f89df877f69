package com.threatintel.riskengine.domain.service.evaluation;

import com.threatintel.riskengine.domain.model.ScoreResult;
import com.threatintel.riskengine.domain.model.SeverityTier;
import com.threatintel.riskengine.domain.service.scoring.RiskScoringService;
import com.threatintel.riskengine.domain.service.scoring.ScoringProperties;
import com.threatintel.riskengine.domain.service.scoring.SeverityTierMapper;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Replays golden incidents through the general-risk model and through a keyword-only
 * baseline (keyword weight times the scale, nothing else), and reports how often each
 * lands on the expected tier.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoringBacktestEvaluator {

    private final RiskScoringService scoringService;
    private final SeverityTierMapper tierMapper;
    private final ScoringProperties properties;

    public BacktestReport run(List<GoldenIncident> incidents) {
        int baselineCorrect = 0;
        int fullCorrect = 0;
        double baselineTotal = 0.0;
        double fullTotal = 0.0;
        List<IncidentRow> rows = new ArrayList<>(incidents.size());

        for (GoldenIncident incident : incidents) {
            double baselineScore = baselineScore(incident.keywordWeight());
            SeverityTier baselineTier = tierMapper.tierFor(baselineScore);

            ScoreResult full = scoringService.scoreGeneral(incident.features());

            boolean baselineMatch = baselineTier == incident.expectedTier();
            boolean fullMatch = full.tier() == incident.expectedTier();
            if (baselineMatch) baselineCorrect++;
            if (fullMatch) fullCorrect++;
            baselineTotal += baselineScore;
            fullTotal += full.score();

            rows.add(IncidentRow.builder()
                    .incident(incident.name())
                    .keyword(incident.keyword())
                    .expectedTier(incident.expectedTier())
                    .baselineScore(baselineScore)
                    .baselineTier(baselineTier)
                    .baselineCorrect(baselineMatch)
                    .fullScore(full.score())
                    .fullTier(full.tier())
                    .fullCorrect(fullMatch)
                    .scoreImprovement(round1(full.score() - baselineScore))
                    .build());
        }

        int n = incidents.size();
        BacktestReport report = BacktestReport.builder()
                .totalIncidents(n)
                .baselineCorrect(baselineCorrect)
                .fullCorrect(fullCorrect)
                .baselineDetectionRate(n > 0 ? round4((double) baselineCorrect / n) : 0.0)
                .fullDetectionRate(n > 0 ? round4((double) fullCorrect / n) : 0.0)
                .baselineMeanScore(n > 0 ? round1(baselineTotal / n) : 0.0)
                .fullMeanScore(n > 0 ? round1(fullTotal / n) : 0.0)
                .meanScoreImprovement(n > 0 ? round1((fullTotal - baselineTotal) / n) : 0.0)
                .incidents(rows)
                .build();

        log.info("[Backtest] incidents={}, baselineRate={}, fullRate={}",
                n, String.format(Locale.ROOT, "%.4f", report.getBaselineDetectionRate()),
                String.format(Locale.ROOT, "%.4f", report.getFullDetectionRate()));
        return report;
    }

    double baselineScore(double keywordWeight) {
        double weight = Double.isNaN(keywordWeight) ? 0.0 : keywordWeight;
        return round1(SeverityTierMapper.clampScore(weight * properties.getGeneral().getScale()));
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static double round4(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }

    @Getter
    @Builder
    public static class BacktestReport {
        private final int totalIncidents;
        private final int baselineCorrect;
        private final int fullCorrect;
        private final double baselineDetectionRate;
        private final double fullDetectionRate;
        private final double baselineMeanScore;
        private final double fullMeanScore;
        private final double meanScoreImprovement;
        private final List<IncidentRow> incidents;
    }

    @Getter
    @Builder
    public static class IncidentRow {
        private final String incident;
        private final String keyword;
        private final SeverityTier expectedTier;
        private final double baselineScore;
        private final SeverityTier baselineTier;
        private final boolean baselineCorrect;
        private final double fullScore;
        private final SeverityTier fullTier;
        private final boolean fullCorrect;
        private final double scoreImprovement;
    }
}
