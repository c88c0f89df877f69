package com.threatintel.riskengine.domain.model;

import java.util.List;

/**
 * Comparisons produced for one run, ready to be appended by the result sink.
 */
public record DisagreementBatch(
        String runId,
        int comparedCount,
        List<DisagreementRecord> disagreements
) {

    public static DisagreementBatch empty(String runId) {
        return new DisagreementBatch(runId, 0, List.of());
    }
}
