package com.threatintel.riskengine.domain.service.scoring;

import com.threatintel.riskengine.domain.model.ExternalSignalFeatures;
import com.threatintel.riskengine.domain.model.InsiderFeatures;
import com.threatintel.riskengine.domain.model.RecordFeatures;
import com.threatintel.riskengine.domain.model.ScoreDimension;
import com.threatintel.riskengine.domain.model.ScoreFactor;
import com.threatintel.riskengine.domain.model.ScoreResult;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.model.SourceType;
import com.threatintel.riskengine.domain.model.VendorFeatures;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Per-record scoring. Every function is a pure function of the record's feature payload
 * and the configured weights, so records can be scored in any order and in parallel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskScoringService {

    private final ScoringProperties properties;
    private final SeverityTierMapper tierMapper;

    public ScoreResult score(SignalRecord record) {
        SourceType sourceType = record.resolvedSourceType();
        RecordFeatures features = record.getFeatures();

        if (sourceType == null) {
            log.warn("[Scoring] record without source type, not scorable: id={}", record.getId());
            return ScoreResult.unscorable(ScoreDimension.GENERAL);
        }
        if (features == null || features.sourceType() != sourceType) {
            log.warn("[Scoring] feature payload missing or mismatched: id={}, sourceType={}, payload={}",
                    record.getId(), sourceType, features != null ? features.sourceType() : null);
            return ScoreResult.unscorable(sourceType.dimension());
        }

        return switch (sourceType) {
            case EXTERNAL_SIGNAL -> scoreGeneral((ExternalSignalFeatures) features);
            case INSIDER_TELEMETRY -> scoreInsider((InsiderFeatures) features);
            case VENDOR_PROFILE -> scoreVendor((VendorFeatures) features);
        };
    }

    public ScoreResult scoreGeneral(ExternalSignalFeatures f) {
        ScoringProperties.General g = properties.getGeneral();

        double keywordWeight = clamp(f.keywordWeight(), 0.0, g.getMaxKeywordWeight());
        double frequency = clamp(f.frequencyFactor(), g.getMinFrequencyFactor(), g.getMaxFrequencyFactor());
        double credibility = clamp(f.sourceCredibility(), 0.0, 1.0);
        double decay = recencyDecay(f.recencyHours());

        double score = generalScore(keywordWeight, frequency, credibility, decay);

        List<Contribution> contributions = new ArrayList<>(4);
        contributions.add(new Contribution(ScoreFactor.KEYWORD_WEIGHT, keywordWeight / g.getMaxKeywordWeight()));
        double frequencySpan = g.getMaxFrequencyFactor() - g.getMinFrequencyFactor();
        contributions.add(new Contribution(ScoreFactor.FREQUENCY_SPIKE,
                frequencySpan > 0 ? (frequency - g.getMinFrequencyFactor()) / frequencySpan : 0.0));
        contributions.add(new Contribution(ScoreFactor.SOURCE_CREDIBILITY, credibility));
        contributions.add(new Contribution(ScoreFactor.RECENCY, decay));

        List<ScoreFactor> factors = material(contributions, g.getMaterialityStrength());

        log.debug("[Scoring] general kw={} freq={} cred={} decay={} -> {}",
                keywordWeight, frequency, credibility, String.format("%.3f", decay), score);

        return new ScoreResult(ScoreDimension.GENERAL, score, tierMapper.tierFor(score), factors, false, true);
    }

    public ScoreResult scoreInsider(InsiderFeatures f) {
        ScoringProperties.Insider w = properties.getInsider();

        List<Contribution> contributions = List.of(
                weighted(ScoreFactor.OFF_HOURS_ACCESS, f.offHoursAccess(), w.getOffHoursAccess()),
                weighted(ScoreFactor.DATA_MOVEMENT_VOLUME, f.dataMovementVolume(), w.getDataMovementVolume()),
                weighted(ScoreFactor.ACCESS_MISMATCH, f.accessMismatch(), w.getAccessMismatch()),
                weighted(ScoreFactor.COMMUNICATION_SHIFT, f.communicationShift(), w.getCommunicationShift()));

        double score = round1(SeverityTierMapper.clampScore(sum(contributions)));
        List<ScoreFactor> factors = material(contributions, properties.getMaterialityPoints());

        return new ScoreResult(ScoreDimension.INSIDER, score, tierMapper.tierFor(score), factors, false, true);
    }

    public ScoreResult scoreVendor(VendorFeatures f) {
        ScoringProperties.Vendor w = properties.getVendor();

        List<Contribution> contributions = List.of(
                weighted(ScoreFactor.GEOGRAPHIC_EXPOSURE, f.geographicExposure(), w.getGeographicExposure()),
                weighted(ScoreFactor.CONCENTRATION_RISK, f.concentrationRisk(), w.getConcentrationRisk()),
                weighted(ScoreFactor.PRIVILEGE_SCOPE, f.privilegeScope(), w.getPrivilegeScope()),
                weighted(ScoreFactor.SENSITIVE_DATA_EXPOSURE, f.sensitiveDataExposure(), w.getSensitiveDataExposure()),
                weighted(ScoreFactor.COMPLIANCE_GAP, f.complianceGap(), w.getComplianceGap()));

        double score = round1(SeverityTierMapper.clampScore(sum(contributions)));
        boolean flagged = score >= w.getFlagThreshold();
        List<ScoreFactor> factors = material(contributions, properties.getMaterialityPoints());

        return new ScoreResult(ScoreDimension.VENDOR, score, tierMapper.tierFor(score), factors, flagged, true);
    }

    /** Inputs are expected to be clamped already. */
    double generalScore(double keywordWeight, double frequency, double credibility, double decay) {
        double raw = keywordWeight * frequency * credibility * decay * properties.getGeneral().getScale();
        return round1(SeverityTierMapper.clampScore(raw));
    }

    /**
     * Linear decay from 1.0 for a fresh signal down to the configured floor at the horizon.
     * Negative ages are treated as fresh.
     */
    public double recencyDecay(double recencyHours) {
        ScoringProperties.General g = properties.getGeneral();
        double hours = Double.isNaN(recencyHours) ? g.getRecencyHorizonHours() : Math.max(0.0, recencyHours);
        double linear = 1.0 - (hours / g.getRecencyHorizonHours());
        return clamp(linear, g.getRecencyFloor(), 1.0);
    }

    private Contribution weighted(ScoreFactor factor, double intensity, double weight) {
        return new Contribution(factor, clamp(intensity, 0.0, 1.0) * Math.max(0.0, weight));
    }

    private static double sum(List<Contribution> contributions) {
        return contributions.stream().mapToDouble(Contribution::value).sum();
    }

    private static List<ScoreFactor> material(List<Contribution> contributions, double cutoff) {
        return contributions.stream()
                .filter(c -> c.value() >= cutoff && c.value() > 0.0)
                .sorted(Comparator.comparingDouble(Contribution::value).reversed()
                        .thenComparing(Contribution::factor))
                .map(Contribution::factor)
                .toList();
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private record Contribution(ScoreFactor factor, double value) {
    }
}
