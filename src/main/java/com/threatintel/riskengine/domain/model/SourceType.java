package com.threatintel.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceType {
    EXTERNAL_SIGNAL("external-signal", ScoreDimension.GENERAL),
    INSIDER_TELEMETRY("insider-telemetry", ScoreDimension.INSIDER),
    VENDOR_PROFILE("vendor-profile", ScoreDimension.VENDOR);

    private final String code;
    private final ScoreDimension dimension;

    SourceType(String code, ScoreDimension dimension) {
        this.code = code;
        this.dimension = dimension;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public ScoreDimension dimension() {
        return dimension;
    }

    @JsonCreator
    public static SourceType fromCode(String code) {
        if (code == null) return null;
        String normalized = code.trim().toLowerCase().replace('_', '-');
        for (SourceType type : values()) {
            if (type.code.equals(normalized)) return type;
        }
        throw new IllegalArgumentException("Unknown source type: " + code);
    }
}
