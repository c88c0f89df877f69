package com.threatintel.riskengine.domain.service.evaluation;

import com.threatintel.riskengine.domain.model.VendorFeatures;

/**
 * Labelled vendor profile. Labels {@code flagged}, {@code watch} and {@code high_risk} are positives.
 */
public record VendorProfileCase(
        String profileId,
        String vendorName,
        String expectedLabel,
        VendorFeatures features
) {
}
