package com.threatintel.riskengine.domain.service.evaluation;

import com.threatintel.riskengine.domain.model.ExternalSignalFeatures;
import com.threatintel.riskengine.domain.model.SeverityTier;

/**
 * Reference incident with the tier an analyst assigned to it.
 */
public record GoldenIncident(
        String name,
        String keyword,
        SeverityTier expectedTier,
        double keywordWeight,
        double frequencyFactor,
        double sourceCredibility,
        double recencyHours,
        String description
) {

    public ExternalSignalFeatures features() {
        return new ExternalSignalFeatures(keywordWeight, frequencyFactor, sourceCredibility, recencyHours);
    }
}
