package com.threatintel.riskengine.domain.service.scoring;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "risk.scoring")
public class ScoringProperties {

    private Tiers tiers = new Tiers();
    private General general = new General();
    private Insider insider = new Insider();
    private Vendor vendor = new Vendor();
    private Confidence confidence = new Confidence();
    private Uncertainty uncertainty = new Uncertainty();
    private Backtest backtest = new Backtest();

    /** Minimum points a weighted-sum factor must contribute to be listed. */
    private double materialityPoints = 5.0;

    /** Lower bound of each tier; a score equal to the bound belongs to that tier. */
    @Getter
    @Setter
    public static class Tiers {
        private double guarded = 30.0;
        private double elevated = 55.0;
        private double high = 70.0;
        private double critical = 85.0;
    }

    @Getter
    @Setter
    public static class General {
        private double scale = 20.0;
        private double recencyHorizonHours = 168.0;
        private double recencyFloor = 0.1;
        private double maxKeywordWeight = 5.0;
        private double minFrequencyFactor = 1.0;
        private double maxFrequencyFactor = 4.0;
        /** Normalised strength (0..1) a multiplicative factor needs to be listed. */
        private double materialityStrength = 0.5;
    }

    @Getter
    @Setter
    public static class Insider {
        private double offHoursAccess = 20.0;
        private double dataMovementVolume = 35.0;
        private double accessMismatch = 30.0;
        private double communicationShift = 15.0;
    }

    @Getter
    @Setter
    public static class Vendor {
        private double geographicExposure = 20.0;
        private double concentrationRisk = 20.0;
        private double privilegeScope = 25.0;
        private double sensitiveDataExposure = 20.0;
        private double complianceGap = 15.0;
        private double flagThreshold = 45.0;
    }

    @Getter
    @Setter
    public static class Confidence {
        private double reasonCodeWeight = 0.40;
        private double sourceTypeWeight = 0.35;
        private double edgeStrengthWeight = 0.25;
        private int reasonCodeSaturation = 4;
        private int sourceTypeSaturation = 3;
        private double edgeStrengthSaturation = 3.0;
        private double highConfidenceThreshold = 0.8;
        private int escalationMinSourceTypes = 3;
    }

    /** Monte Carlo jitter applied to the general-risk inputs. */
    @Getter
    @Setter
    public static class Uncertainty {
        private int sampleCount = 500;
        private int minSampleCount = 100;
        /** Fixed seed for reproducible intervals; null draws a fresh stream per call. */
        private Long seed = 0L;
        private double keywordWeightSigmaRatio = 0.15;
        private double minKeywordWeightSigma = 0.05;
        private double minKeywordWeight = 0.1;
        private double frequencySigma = 0.20;
        private double recencySigma = 0.03;
        /** alpha + beta of the Beta distribution centred on the point credibility. */
        private double credibilityConcentration = 20.0;
        private int maxTruncationAttempts = 20;
    }

    @Getter
    @Setter
    public static class Backtest {
        private String datasetLocation = "classpath:evaluation/golden-incidents.json";
    }
}
