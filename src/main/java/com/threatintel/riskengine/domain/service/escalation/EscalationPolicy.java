package com.threatintel.riskengine.domain.service.escalation;

import com.threatintel.riskengine.domain.model.EscalationDecision;
import com.threatintel.riskengine.domain.model.SeverityTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Maps (tier, confidence) to an escalation decision. Stateless and side-effect free.
 * CRITICAL always escalates and always carries the shortest configured response window.
 */
@Component
@RequiredArgsConstructor
public class EscalationPolicy {

    private final EscalationProperties properties;

    public EscalationDecision decide(SeverityTier tier, double confidence) {
        EscalationProperties.TierPolicy policy = policyFor(tier);
        List<String> notify = policy.getNotify() != null ? List.copyOf(policy.getNotify()) : List.of();

        if (tier == SeverityTier.CRITICAL) {
            return new EscalationDecision(tier, true, shortestWindow(), notify, policy.getAction());
        }

        boolean escalate = policy.isEscalate() && confidence >= policy.getMinConfidence();
        return new EscalationDecision(tier, escalate, policy.getResponseWindow(),
                escalate ? notify : List.of(), policy.getAction());
    }

    EscalationProperties.TierPolicy policyFor(SeverityTier tier) {
        return switch (tier) {
            case CRITICAL -> properties.getCritical();
            case HIGH -> properties.getHigh();
            case ELEVATED -> properties.getElevated();
            case GUARDED -> properties.getGuarded();
            case LOW -> properties.getLow();
        };
    }

    private Duration shortestWindow() {
        Duration shortest = properties.getCritical().getResponseWindow();
        for (SeverityTier tier : SeverityTier.values()) {
            Duration window = policyFor(tier).getResponseWindow();
            if (window != null && (shortest == null || window.compareTo(shortest) < 0)) {
                shortest = window;
            }
        }
        return shortest;
    }
}
