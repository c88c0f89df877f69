package com.threatintel.riskengine.domain.port;

import com.threatintel.riskengine.domain.model.SeverityTier;

import java.util.Optional;

/**
 * Optional tier label from a secondary classifier. Implementations may throw; callers
 * treat any failure as "no comparison possible".
 */
@FunctionalInterface
public interface SecondarySeveritySignal {

    SecondarySeveritySignal NONE = recordId -> Optional.empty();

    Optional<SeverityTier> tierFor(String recordId);
}
