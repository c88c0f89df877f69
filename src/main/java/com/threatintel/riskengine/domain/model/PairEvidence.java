package com.threatintel.riskengine.domain.model;

import java.util.List;
import java.util.Set;

/**
 * Justification for one admitted correlation edge. {@code recordA} sorts before {@code recordB}.
 */
public record PairEvidence(
        String recordA,
        String recordB,
        Set<ReasonCode> reasonCodes,
        List<Pivot> sharedPivots,
        long deltaSeconds
) {

    /** Edge strength used by thread confidence: number of reason codes on the edge. */
    public int strength() {
        return reasonCodes.size();
    }
}
