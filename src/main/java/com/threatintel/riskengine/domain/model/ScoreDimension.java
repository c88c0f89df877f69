package com.threatintel.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Scoring function that produced a record's score. Threads report their worst
 * member score per dimension.
 */
public enum ScoreDimension {
    GENERAL("general_risk"),
    INSIDER("insider_risk"),
    VENDOR("vendor_risk");

    private final String code;

    ScoreDimension(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Accepts the code or the constant name; also used for map keys. */
    @JsonCreator
    public static ScoreDimension fromCode(String code) {
        if (code == null) return null;
        String normalized = code.trim();
        for (ScoreDimension dimension : values()) {
            if (dimension.code.equalsIgnoreCase(normalized) || dimension.name().equalsIgnoreCase(normalized)) {
                return dimension;
            }
        }
        throw new IllegalArgumentException("Unknown score dimension: " + code);
    }
}
