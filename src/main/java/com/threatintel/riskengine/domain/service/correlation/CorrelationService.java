package com.threatintel.riskengine.domain.service.correlation;

import com.threatintel.riskengine.domain.model.CorrelationResult;
import com.threatintel.riskengine.domain.model.CorrelationThread;
import com.threatintel.riskengine.domain.model.CorrelationWindow;
import com.threatintel.riskengine.domain.model.DisagreementBatch;
import com.threatintel.riskengine.domain.model.ScoreResult;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.port.RecordSource;
import com.threatintel.riskengine.domain.port.ResultSink;
import com.threatintel.riskengine.domain.service.correlation.CorrelationEngine.RecordCluster;
import com.threatintel.riskengine.domain.service.correlation.CorrelationRunRegistry.RunLease;
import com.threatintel.riskengine.domain.service.disagreement.DisagreementMonitor;
import com.threatintel.riskengine.domain.service.scoring.RiskScoringService;
import com.threatintel.riskengine.infra.metrics.CorrelationMetrics;
import com.threatintel.riskengine.util.Hashing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Batch correlation over a bounded window.
 * <p>
 * Phases: read records, score them in parallel, index and cluster the correlatable ones,
 * assemble threads, compare against the secondary signal, then hand everything to the
 * result sink in one write. A run can be cancelled up to that write; nothing is persisted
 * for a cancelled run.
 */
@Slf4j
@Service
public class CorrelationService {

    private final RecordSource recordSource;
    private final ResultSink resultSink;
    private final RiskScoringService scoringService;
    private final CorrelationEngine correlationEngine;
    private final ThreadAssembler threadAssembler;
    private final DisagreementMonitor disagreementMonitor;
    private final CorrelationRunRegistry runRegistry;
    private final CorrelationProperties properties;
    private final CorrelationMetrics metrics;
    private final ExecutorService scoringExecutor;

    public CorrelationService(RecordSource recordSource,
                              ResultSink resultSink,
                              RiskScoringService scoringService,
                              CorrelationEngine correlationEngine,
                              ThreadAssembler threadAssembler,
                              DisagreementMonitor disagreementMonitor,
                              CorrelationRunRegistry runRegistry,
                              CorrelationProperties properties,
                              CorrelationMetrics metrics,
                              @Qualifier("scoringExecutor") ExecutorService scoringExecutor) {
        this.recordSource = recordSource;
        this.resultSink = resultSink;
        this.scoringService = scoringService;
        this.correlationEngine = correlationEngine;
        this.threadAssembler = threadAssembler;
        this.disagreementMonitor = disagreementMonitor;
        this.runRegistry = runRegistry;
        this.properties = properties;
        this.metrics = metrics;
        this.scoringExecutor = scoringExecutor;
    }

    /**
     * @param windowHours    temporal gate between two linked records; configured default when null
     * @param minClusterSize smallest thread emitted; configured default when null, never below 2
     */
    public CorrelationResult correlate(Instant windowStart, Instant windowEnd,
                                       Double windowHours, Integer minClusterSize) {
        CorrelationWindow window = new CorrelationWindow(windowStart, windowEnd,
                windowHours != null ? windowHours : properties.getDefaultWindowHours(),
                minClusterSize != null ? minClusterSize : properties.getDefaultMinClusterSize());
        return correlate(window);
    }

    public CorrelationResult correlate(CorrelationWindow window) {
        long started = System.nanoTime();

        RunLease lease;
        try {
            lease = runRegistry.acquire(window);
        } catch (CorrelationRunInProgressException e) {
            metrics.runRejected();
            log.warn("[Correlation] run rejected, overlapping window in progress: requested={}..{}, active={}..{}",
                    window.start(), window.end(), e.getActive().start(), e.getActive().end());
            throw e;
        }

        try (lease) {
            List<SignalRecord> records = uniqueRecords(recordSource.findInWindow(window.start(), window.end()));
            checkpoint(lease, "read");

            List<SignalRecord> scored = scoreAll(records);
            checkpoint(lease, "scoring");

            List<SignalRecord> correlatable = new ArrayList<>(scored.size());
            List<String> skipped = new ArrayList<>();
            for (SignalRecord record : scored) {
                if (record.isCorrelatable()) {
                    correlatable.add(record);
                } else {
                    skipped.add(record.getId());
                    log.warn("[Correlation] record kept out of clustering: id={}, timestamp={}, pivots={}",
                            record.getId(), record.getTimestamp(), record.getPivots() == null ? "missing" : "present");
                }
            }

            PivotIndex index = PivotIndex.build(correlatable);
            List<RecordCluster> clusters = correlationEngine.cluster(index, window.edgeGate(), window.minClusterSize());
            checkpoint(lease, "clustering");

            List<CorrelationThread> threads = threadAssembler.assemble(clusters);
            String runId = runId(window, scored);
            DisagreementBatch batch = disagreementMonitor.compare(runId, scored);

            CorrelationResult result = new CorrelationResult(runId, window, threads, scored,
                    List.copyOf(skipped), batch.comparedCount(), batch.disagreements().size());
            checkpoint(lease, "write");

            resultSink.replaceWindow(result);
            int inserted = resultSink.appendDisagreements(batch);
            metrics.disagreementsInserted(inserted);

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            metrics.recordRun(elapsed, threads.size(), skipped.size());
            log.info("[Correlation] run complete: runId={}, window={}..{}, records={}, threads={}, skipped={}, " +
                            "compared={}, newDisagreements={}, elapsedMs={}",
                    runId, window.start(), window.end(), scored.size(), threads.size(), skipped.size(),
                    batch.comparedCount(), inserted, elapsed.toMillis());
            return result;
        } catch (CorrelationRunAbortedException e) {
            metrics.runAborted();
            log.info("[Correlation] {}", e.getMessage());
            throw e;
        }
    }

    /** Single-record scoring, synchronous and side-effect free. */
    public ScoreResult score(SignalRecord record) {
        return scoringService.score(record);
    }

    /**
     * Scores every record on the scoring pool. Results keep input order. Records without a
     * usable feature payload are returned unscored.
     */
    List<SignalRecord> scoreAll(List<SignalRecord> records) {
        List<CompletableFuture<SignalRecord>> futures = records.stream()
                .map(record -> CompletableFuture.supplyAsync(() -> scoreOne(record), scoringExecutor))
                .toList();
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) throw runtime;
            throw new IllegalStateException("record scoring failed", cause);
        }
    }

    private SignalRecord scoreOne(SignalRecord record) {
        ScoreResult result = scoringService.score(record);
        return result.scorable() ? record.withScore(result) : record;
    }

    /**
     * Drops records without an id and keeps the first occurrence of a duplicated id.
     */
    private static List<SignalRecord> uniqueRecords(List<SignalRecord> records) {
        Map<String, SignalRecord> byId = new LinkedHashMap<>();
        for (SignalRecord record : records) {
            if (record.getId() == null) {
                log.warn("[Correlation] record without id ignored: sourceType={}", record.getSourceType());
                continue;
            }
            if (byId.putIfAbsent(record.getId(), record) != null) {
                log.warn("[Correlation] duplicate record id ignored: id={}", record.getId());
            }
        }
        return new ArrayList<>(byId.values());
    }

    /**
     * Same window parameters over the same scored data give the same run id, so a repeated
     * run is deduplicated by the disagreement idempotency key.
     */
    static String runId(CorrelationWindow window, List<SignalRecord> scored) {
        StringBuilder sb = new StringBuilder()
                .append(window.storageKey()).append('|')
                .append(window.windowHours()).append('|')
                .append(window.minClusterSize());
        scored.stream()
                .map(r -> r.getId() + ":" + r.getSeverityTier() + ":" + r.getRiskScore() + ":" + r.getSecondaryTier())
                .sorted()
                .forEach(s -> sb.append('|').append(s));
        return Hashing.shortId("run-", sb.toString(), 16);
    }

    private static void checkpoint(RunLease lease, String phase) {
        if (lease.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new CorrelationRunAbortedException(phase);
        }
    }
}
