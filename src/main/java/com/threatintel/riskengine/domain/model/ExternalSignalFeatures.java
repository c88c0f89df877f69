package com.threatintel.riskengine.domain.model;

/**
 * @param keywordWeight     weight of the matched keyword, nominally 0.1 to 5.0
 * @param frequencyFactor   spike multiplier derived from keyword frequency, nominally 1.0 to 4.0
 * @param sourceCredibility credibility of the publishing source, 0.0 to 1.0
 * @param recencyHours      hours between publication and scoring
 */
public record ExternalSignalFeatures(
        double keywordWeight,
        double frequencyFactor,
        double sourceCredibility,
        double recencyHours
) implements RecordFeatures {

    @Override
    public SourceType sourceType() {
        return SourceType.EXTERNAL_SIGNAL;
    }
}
