package com.threatintel.riskengine.domain.service.scoring;

import com.threatintel.riskengine.domain.model.SeverityTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Step function from score to tier using the configured lower bounds.
 */
@Component
@RequiredArgsConstructor
public class SeverityTierMapper {

    private final ScoringProperties properties;

    public SeverityTier tierFor(double score) {
        ScoringProperties.Tiers t = properties.getTiers();
        if (score >= t.getCritical()) return SeverityTier.CRITICAL;
        if (score >= t.getHigh()) return SeverityTier.HIGH;
        if (score >= t.getElevated()) return SeverityTier.ELEVATED;
        if (score >= t.getGuarded()) return SeverityTier.GUARDED;
        return SeverityTier.LOW;
    }

    public static double clampScore(double score) {
        if (Double.isNaN(score)) return 0.0;
        return Math.max(0.0, Math.min(100.0, score));
    }
}
