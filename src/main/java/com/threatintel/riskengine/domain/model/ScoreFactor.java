package com.threatintel.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Explainable contributors to a record score, grouped by the scoring function that uses them.
 */
public enum ScoreFactor {
    KEYWORD_WEIGHT(ScoreDimension.GENERAL),
    FREQUENCY_SPIKE(ScoreDimension.GENERAL),
    SOURCE_CREDIBILITY(ScoreDimension.GENERAL),
    RECENCY(ScoreDimension.GENERAL),

    OFF_HOURS_ACCESS(ScoreDimension.INSIDER),
    DATA_MOVEMENT_VOLUME(ScoreDimension.INSIDER),
    ACCESS_MISMATCH(ScoreDimension.INSIDER),
    COMMUNICATION_SHIFT(ScoreDimension.INSIDER),

    GEOGRAPHIC_EXPOSURE(ScoreDimension.VENDOR),
    CONCENTRATION_RISK(ScoreDimension.VENDOR),
    PRIVILEGE_SCOPE(ScoreDimension.VENDOR),
    SENSITIVE_DATA_EXPOSURE(ScoreDimension.VENDOR),
    COMPLIANCE_GAP(ScoreDimension.VENDOR);

    private final ScoreDimension dimension;

    ScoreFactor(ScoreDimension dimension) {
        this.dimension = dimension;
    }

    public ScoreDimension dimension() {
        return dimension;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ScoreFactor fromCode(String code) {
        return valueOf(code.trim().toUpperCase());
    }
}
