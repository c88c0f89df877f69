package com.threatintel.riskengine.domain.model;

/**
 * Third-party exposure factors, each 0.0 (none) to 1.0 (maximal).
 * {@code complianceGap} is the inverse of compliance posture.
 */
public record VendorFeatures(
        double geographicExposure,
        double concentrationRisk,
        double privilegeScope,
        double sensitiveDataExposure,
        double complianceGap
) implements RecordFeatures {

    @Override
    public SourceType sourceType() {
        return SourceType.VENDOR_PROFILE;
    }
}
