package com.threatintel.riskengine.domain.model;

/**
 * Behavioural indicator intensities, each 0.0 (absent) to 1.0 (maximal).
 */
public record InsiderFeatures(
        double offHoursAccess,
        double dataMovementVolume,
        double accessMismatch,
        double communicationShift
) implements RecordFeatures {

    @Override
    public SourceType sourceType() {
        return SourceType.INSIDER_TELEMETRY;
    }
}
