package com.threatintel.riskengine.domain.model;

import java.util.List;

/**
 * @param skippedRecordIds records excluded from clustering because they lacked a timestamp or pivot set
 * @param comparedCount    records that carried both a rules tier and a secondary tier
 */
public record CorrelationResult(
        String runId,
        CorrelationWindow window,
        List<CorrelationThread> threads,
        List<SignalRecord> scoredRecords,
        List<String> skippedRecordIds,
        int comparedCount,
        int disagreementCount
) {
}
