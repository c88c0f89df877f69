package com.threatintel.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumMap;
import java.util.Map;

/**
 * Justification attached to a correlation edge. The set is closed: every pivot type has
 * exactly one {@code shared_*} code, plus the two comparison codes.
 */
public enum ReasonCode {
    SHARED_USER_ID(PivotType.USER_ID),
    SHARED_DEVICE_ID(PivotType.DEVICE_ID),
    SHARED_VENDOR_ID(PivotType.VENDOR_ID),
    SHARED_ACTOR_HANDLE(PivotType.ACTOR_HANDLE),
    SHARED_DOMAIN(PivotType.DOMAIN),
    SHARED_IPV4(PivotType.IPV4),
    SHARED_IPV6(PivotType.IPV6),
    SHARED_URL(PivotType.URL),
    SHARED_EMAIL(PivotType.EMAIL),
    SHARED_CVE(PivotType.CVE),
    SHARED_MD5(PivotType.MD5),
    SHARED_SHA1(PivotType.SHA1),
    SHARED_SHA256(PivotType.SHA256),
    CROSS_SOURCE(null),
    TIGHT_TEMPORAL(null);

    private static final Map<PivotType, ReasonCode> BY_PIVOT = new EnumMap<>(PivotType.class);

    static {
        for (ReasonCode code : values()) {
            if (code.pivotType != null) {
                BY_PIVOT.put(code.pivotType, code);
            }
        }
    }

    private final PivotType pivotType;

    ReasonCode(PivotType pivotType) {
        this.pivotType = pivotType;
    }

    public static ReasonCode sharedPivot(PivotType type) {
        ReasonCode code = BY_PIVOT.get(type);
        if (code == null) {
            throw new IllegalStateException("No shared reason code for pivot type " + type);
        }
        return code;
    }

    public boolean isSharedPivot() {
        return pivotType != null;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ReasonCode fromCode(String code) {
        return valueOf(code.trim().toUpperCase());
    }
}
