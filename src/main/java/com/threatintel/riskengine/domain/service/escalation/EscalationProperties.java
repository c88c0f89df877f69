package com.threatintel.riskengine.domain.service.escalation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "risk.escalation")
public class EscalationProperties {

    private TierPolicy critical = new TierPolicy(true, 0.0, Duration.ofMinutes(30),
            new ArrayList<>(List.of("detail_leader", "intel_manager")),
            "Immediate briefing required.");

    private TierPolicy high = new TierPolicy(true, 0.5, Duration.ofHours(4),
            new ArrayList<>(List.of("intel_analyst")),
            "Enhanced monitoring. Assess within 4 hours.");

    private TierPolicy elevated = new TierPolicy(false, 0.0, Duration.ofHours(24),
            new ArrayList<>(), "Log and monitor.");

    private TierPolicy guarded = new TierPolicy(false, 0.0, Duration.ofHours(72),
            new ArrayList<>(), "Reassess at next collection cycle.");

    private TierPolicy low = new TierPolicy(false, 0.0, null,
            new ArrayList<>(), "No immediate action.");

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierPolicy {
        private boolean escalate;
        /** Confidence required before {@code escalate} takes effect. */
        private double minConfidence;
        private Duration responseWindow;
        private List<String> notify = new ArrayList<>();
        private String action;
    }
}
