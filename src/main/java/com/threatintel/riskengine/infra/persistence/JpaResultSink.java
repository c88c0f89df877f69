package com.threatintel.riskengine.infra.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatintel.riskengine.domain.model.ComparisonRunRecord;
import com.threatintel.riskengine.domain.model.CorrelationResult;
import com.threatintel.riskengine.domain.model.CorrelationThread;
import com.threatintel.riskengine.domain.model.DisagreementBatch;
import com.threatintel.riskengine.domain.model.DisagreementRecord;
import com.threatintel.riskengine.domain.model.RecordScoreSnapshot;
import com.threatintel.riskengine.domain.model.ScoreFactor;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.model.ThreadSnapshotRecord;
import com.threatintel.riskengine.domain.port.ResultSink;
import com.threatintel.riskengine.domain.repository.ComparisonRunRepository;
import com.threatintel.riskengine.domain.repository.DisagreementRepository;
import com.threatintel.riskengine.domain.repository.RecordScoreRepository;
import com.threatintel.riskengine.domain.repository.ThreadSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaResultSink implements ResultSink {

    private final ThreadSnapshotRepository threadRepository;
    private final RecordScoreRepository recordScoreRepository;
    private final DisagreementRepository disagreementRepository;
    private final ComparisonRunRepository comparisonRunRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional
    public void replaceWindow(CorrelationResult result) {
        String windowKey = result.window().storageKey();
        long now = System.currentTimeMillis();

        int removedThreads = threadRepository.deleteByWindowKey(windowKey);
        int removedScores = recordScoreRepository.deleteByWindowKey(windowKey);

        Set<String> clustered = new HashSet<>();
        List<ThreadSnapshotRecord> threads = new ArrayList<>(result.threads().size());
        for (CorrelationThread thread : result.threads()) {
            clustered.addAll(thread.memberIds());
            threads.add(toSnapshot(windowKey, result.runId(), thread, now));
        }
        threadRepository.saveAll(threads);

        List<RecordScoreSnapshot> scores = result.scoredRecords().stream()
                .map(r -> toSnapshot(windowKey, result.runId(), r, clustered.contains(r.getId()), now))
                .toList();
        recordScoreRepository.saveAll(scores);

        log.info("[ResultSink] window replaced: key={}, runId={}, threads {} -> {}, scores {} -> {}",
                windowKey, result.runId(), removedThreads, threads.size(), removedScores, scores.size());
    }

    /**
     * Each row commits on its own, so a concurrent duplicate only loses that row.
     */
    @Override
    public int appendDisagreements(DisagreementBatch batch) {
        if (batch.comparedCount() > 0 && !comparisonRunRepository.existsByRunId(batch.runId())) {
            try {
                comparisonRunRepository.save(ComparisonRunRecord.builder()
                        .runId(batch.runId())
                        .comparedCount(batch.comparedCount())
                        .mismatchCount(batch.disagreements().size())
                        .createdAtEpochMs(System.currentTimeMillis())
                        .build());
            } catch (DataIntegrityViolationException e) {
                log.debug("[ResultSink] comparison run already recorded concurrently: runId={}", batch.runId());
            }
        }

        int inserted = 0;
        for (DisagreementRecord record : batch.disagreements()) {
            if (disagreementRepository.existsByRecordIdAndRunId(record.getRecordId(), record.getRunId())) {
                continue;
            }
            try {
                disagreementRepository.save(record);
                inserted++;
            } catch (DataIntegrityViolationException e) {
                log.debug("[ResultSink] disagreement already recorded concurrently: recordId={}, runId={}",
                        record.getRecordId(), record.getRunId());
            }
        }
        return inserted;
    }

    private ThreadSnapshotRecord toSnapshot(String windowKey, String runId, CorrelationThread thread, long now) {
        return ThreadSnapshotRecord.builder()
                .windowKey(windowKey)
                .runId(runId)
                .threadId(thread.threadId())
                .label(thread.label())
                .memberCount(thread.memberCount())
                .aggregateScore(thread.aggregateScore())
                .confidence(thread.confidence())
                .recommendedTier(thread.recommendedTier())
                .windowStartEpochMs(thread.windowStart().toEpochMilli())
                .windowEndEpochMs(thread.windowEnd().toEpochMilli())
                .payloadJson(toJson(thread))
                .writtenAtEpochMs(now)
                .build();
    }

    private RecordScoreSnapshot toSnapshot(String windowKey, String runId, SignalRecord record,
                                           boolean clustered, long now) {
        String factors = record.getScoreFactors() == null ? null : record.getScoreFactors().stream()
                .map(ScoreFactor::code)
                .collect(Collectors.joining(","));
        return RecordScoreSnapshot.builder()
                .windowKey(windowKey)
                .runId(runId)
                .recordId(record.getId())
                .sourceType(record.resolvedSourceType())
                .riskScore(record.getRiskScore() != null ? record.getRiskScore() : 0.0)
                .severityTier(record.getSeverityTier())
                .scoreFactors(factors)
                .vendorFlagged(record.getVendorFlagged())
                .clustered(clustered)
                .scoredAtEpochMs(now)
                .build();
    }

    private String toJson(CorrelationThread thread) {
        try {
            return objectMapper.writeValueAsString(thread);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialise thread " + thread.threadId(), e);
        }
    }
}
