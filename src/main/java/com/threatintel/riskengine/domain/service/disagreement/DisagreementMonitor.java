package com.threatintel.riskengine.domain.service.disagreement;

import com.threatintel.riskengine.domain.model.AnalystVerdict;
import com.threatintel.riskengine.domain.model.ComparisonRunRecord;
import com.threatintel.riskengine.domain.model.DisagreementBatch;
import com.threatintel.riskengine.domain.model.DisagreementRecord;
import com.threatintel.riskengine.domain.model.SeverityTier;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.port.SecondarySeveritySignal;
import com.threatintel.riskengine.domain.repository.ComparisonRunRepository;
import com.threatintel.riskengine.domain.repository.DisagreementRepository;
import com.threatintel.riskengine.infra.metrics.CorrelationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares rules-derived tiers against the secondary classifier's tiers.
 * <p>
 * The secondary signal is optional: a missing label or a failing lookup means "no comparison"
 * for that record and never interrupts the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DisagreementMonitor {

    private final SecondarySeveritySignal secondarySignal;
    private final DisagreementRepository disagreementRepository;
    private final ComparisonRunRepository comparisonRunRepository;
    private final CorrelationMetrics metrics;

    public DisagreementBatch compare(String runId, List<SignalRecord> scoredRecords) {
        int compared = 0;
        long now = System.currentTimeMillis();
        List<DisagreementRecord> mismatches = new ArrayList<>();

        for (SignalRecord record : scoredRecords) {
            if (record.getId() == null || !record.isScored()) continue;

            Optional<SeverityTier> secondary = secondaryTierOf(record);
            if (secondary.isEmpty()) continue;

            compared++;
            if (secondary.get() != record.getSeverityTier()) {
                mismatches.add(DisagreementRecord.builder()
                        .recordId(record.getId())
                        .runId(runId)
                        .rulesTier(record.getSeverityTier())
                        .secondaryTier(secondary.get())
                        .rulesScore(record.getRiskScore())
                        .createdAtEpochMs(now)
                        .build());
            }
        }

        if (compared > 0) {
            log.info("[Disagreement] runId={}, compared={}, mismatches={}", runId, compared, mismatches.size());
        }
        return new DisagreementBatch(runId, compared, List.copyOf(mismatches));
    }

    Optional<SeverityTier> secondaryTierOf(SignalRecord record) {
        if (record.getSecondaryTier() != null) {
            return Optional.of(record.getSecondaryTier());
        }
        try {
            Optional<SeverityTier> tier = secondarySignal.tierFor(record.getId());
            return tier != null ? tier : Optional.empty();
        } catch (RuntimeException e) {
            metrics.secondarySignalFailed();
            log.warn("[Disagreement] secondary signal unavailable, skipping comparison: recordId={}, cause={}",
                    record.getId(), e.toString());
            return Optional.empty();
        }
    }

    /**
     * Mismatches over records compared in the run. 0.0 for unknown runs and runs without
     * any comparison. Read-only.
     */
    @Transactional(readOnly = true)
    public double disagreementRate(String runId) {
        return comparisonRunRepository.findByRunId(runId)
                .filter(run -> run.getComparedCount() > 0)
                .map(run -> (double) disagreementRepository.countByRunId(runId) / run.getComparedCount())
                .orElse(0.0);
    }

    @Transactional(readOnly = true)
    public Optional<ComparisonRunRecord> findRun(String runId) {
        return comparisonRunRepository.findByRunId(runId);
    }

    @Transactional(readOnly = true)
    public List<DisagreementRecord> findByRun(String runId) {
        return disagreementRepository.findByRunIdOrderByRecordIdAsc(runId);
    }

    @Transactional(readOnly = true)
    public long pendingAdjudication() {
        return disagreementRepository.countByAnalystVerdictIsNull();
    }

    /** Fills the analyst verdict; the only mutation a disagreement row ever receives. */
    @Transactional
    public DisagreementRecord adjudicate(Long id, AnalystVerdict verdict) {
        if (verdict == null) {
            throw new IllegalArgumentException("verdict is required");
        }
        DisagreementRecord record = disagreementRepository.findById(id)
                .orElseThrow(() -> new DisagreementNotFoundException(id));
        record.setAnalystVerdict(verdict);
        record.setAdjudicatedAtEpochMs(System.currentTimeMillis());
        log.info("[Disagreement] adjudicated: id={}, recordId={}, verdict={}", id, record.getRecordId(), verdict);
        return disagreementRepository.save(record);
    }
}
