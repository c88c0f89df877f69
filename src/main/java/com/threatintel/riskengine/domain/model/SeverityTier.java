package com.threatintel.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Ordered severity buckets. Declaration order is the severity order.
 */
public enum SeverityTier {
    LOW, GUARDED, ELEVATED, HIGH, CRITICAL;

    public SeverityTier escalate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }

    public boolean isAbove(SeverityTier other) {
        return ordinal() > other.ordinal();
    }

    public static SeverityTier max(SeverityTier a, SeverityTier b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    @JsonCreator
    public static SeverityTier fromLabel(String label) {
        if (label == null || label.isBlank()) return null;
        return valueOf(label.trim().toUpperCase());
    }
}
