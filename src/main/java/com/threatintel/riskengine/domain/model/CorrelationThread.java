package com.threatintel.riskengine.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Connected cluster of records linked through shared pivots. Collections are sorted so
 * that two runs over the same data compare equal field for field.
 */
@Builder
public record CorrelationThread(
        String threadId,
        String label,
        List<String> memberIds,
        int memberCount,
        Set<SourceType> sourceTypes,
        Instant windowStart,
        Instant windowEnd,
        List<Pivot> sharedPivots,
        Set<ReasonCode> reasonCodes,
        List<PairEvidence> evidence,
        double aggregateScore,
        Map<ScoreDimension, Double> maxScoreByDimension,
        double confidence,
        SeverityTier scoreTier,
        SeverityTier recommendedTier,
        EscalationDecision escalation
) {
}
