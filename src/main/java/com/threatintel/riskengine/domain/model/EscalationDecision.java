package com.threatintel.riskengine.domain.model;

import java.time.Duration;
import java.util.List;

/**
 * @param targetResponseTime null when the tier carries no mandated response time
 */
public record EscalationDecision(
        SeverityTier tier,
        boolean escalate,
        Duration targetResponseTime,
        List<String> notifyRoles,
        String action
) {
}
