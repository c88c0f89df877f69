package com.threatintel.riskengine.domain.service.scoring;

import com.threatintel.riskengine.domain.model.PairEvidence;
import com.threatintel.riskengine.domain.model.ReasonCode;
import com.threatintel.riskengine.domain.model.ScoreDimension;
import com.threatintel.riskengine.domain.model.SeverityTier;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.model.SourceType;
import lombok.Builder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Thread-level aggregation over already scored members.
 * <p>
 * aggregate = max member score (never a sum, so thread size alone cannot raise it);
 * confidence = weighted blend of reason-code diversity, source-type diversity and mean
 * edge strength, each saturating at its configured point.
 */
@Component
@RequiredArgsConstructor
public class ThreadScorer {

    private final ScoringProperties properties;
    private final SeverityTierMapper tierMapper;

    public ThreadScore score(Collection<SignalRecord> members, List<PairEvidence> evidence) {
        double aggregate = 0.0;
        Map<ScoreDimension, Double> maxByDimension = new EnumMap<>(ScoreDimension.class);
        Set<SourceType> sourceTypes = EnumSet.noneOf(SourceType.class);

        for (SignalRecord member : members) {
            SourceType type = member.resolvedSourceType();
            if (type != null) sourceTypes.add(type);

            double memberScore = member.getRiskScore() != null ? member.getRiskScore() : 0.0;
            aggregate = Math.max(aggregate, memberScore);
            if (type != null) {
                maxByDimension.merge(type.dimension(), memberScore, Math::max);
            }
        }

        double confidence = confidence(evidence, sourceTypes.size());
        SeverityTier scoreTier = tierMapper.tierFor(aggregate);
        SeverityTier recommended = recommend(scoreTier, confidence, sourceTypes.size());

        return ThreadScore.builder()
                .aggregateScore(aggregate)
                .maxScoreByDimension(maxByDimension)
                .sourceTypes(sourceTypes)
                .confidence(confidence)
                .scoreTier(scoreTier)
                .recommendedTier(recommended)
                .build();
    }

    public double confidence(List<PairEvidence> evidence, int distinctSourceTypes) {
        if (evidence == null || evidence.isEmpty()) return 0.0;

        ScoringProperties.Confidence c = properties.getConfidence();

        Set<ReasonCode> codes = EnumSet.noneOf(ReasonCode.class);
        double strengthSum = 0.0;
        for (PairEvidence e : evidence) {
            codes.addAll(e.reasonCodes());
            strengthSum += e.strength();
        }
        double meanStrength = strengthSum / evidence.size();

        double value = c.getReasonCodeWeight() * saturate(codes.size(), c.getReasonCodeSaturation())
                + c.getSourceTypeWeight() * saturate(distinctSourceTypes, c.getSourceTypeSaturation())
                + c.getEdgeStrengthWeight() * saturate(meanStrength, c.getEdgeStrengthSaturation());

        return Math.round(Math.max(0.0, Math.min(1.0, value)) * 1000.0) / 1000.0;
    }

    /** Raises the tier one step on high confidence across enough source types; never lowers it. */
    public SeverityTier recommend(SeverityTier scoreTier, double confidence, int distinctSourceTypes) {
        ScoringProperties.Confidence c = properties.getConfidence();
        if (confidence >= c.getHighConfidenceThreshold()
                && distinctSourceTypes >= c.getEscalationMinSourceTypes()) {
            return scoreTier.escalate();
        }
        return scoreTier;
    }

    private static double saturate(double value, double saturationPoint) {
        if (saturationPoint <= 0) return 1.0;
        return Math.min(1.0, value / saturationPoint);
    }

    @Getter
    @Builder
    public static class ThreadScore {
        private final double aggregateScore;
        private final Map<ScoreDimension, Double> maxScoreByDimension;
        private final Set<SourceType> sourceTypes;
        private final double confidence;
        private final SeverityTier scoreTier;
        private final SeverityTier recommendedTier;
    }
}
