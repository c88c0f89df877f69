package com.threatintel.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Normalised security record handed over by a collector. Instances are immutable;
 * scoring produces a copy through {@link #withScore(ScoreResult)}.
 */
@Getter
@EqualsAndHashCode
@ToString
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignalRecord {

    private final String id;
    private final SourceType sourceType;
    private final Instant timestamp;
    private final Set<Pivot> pivots;
    private final String content;
    private final RecordFeatures features;

    private final Double riskScore;
    private final SeverityTier severityTier;
    private final List<ScoreFactor> scoreFactors;
    private final Boolean vendorFlagged;

    /** Tier label supplied by the secondary classifier, when the collector attached one. */
    private final SeverityTier secondaryTier;

    @JsonIgnore
    public SourceType resolvedSourceType() {
        if (sourceType != null) return sourceType;
        return features != null ? features.sourceType() : null;
    }

    /** A record without timestamp or pivot set cannot take part in correlation edges. */
    @JsonIgnore
    public boolean isCorrelatable() {
        return id != null && timestamp != null && pivots != null;
    }

    @JsonIgnore
    public boolean isScored() {
        return riskScore != null && severityTier != null;
    }

    public SignalRecord withScore(ScoreResult result) {
        return toBuilder()
                .riskScore(result.score())
                .severityTier(result.tier())
                .scoreFactors(result.factors())
                .vendorFlagged(result.dimension() == ScoreDimension.VENDOR ? result.flagged() : null)
                .build();
    }
}
