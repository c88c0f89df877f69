package com.threatintel.riskengine.support;

import com.threatintel.riskengine.domain.port.RecordSource;
import com.threatintel.riskengine.domain.port.ResultSink;
import com.threatintel.riskengine.domain.port.SecondarySeveritySignal;
import com.threatintel.riskengine.domain.repository.ComparisonRunRepository;
import com.threatintel.riskengine.domain.repository.DisagreementRepository;
import com.threatintel.riskengine.domain.service.correlation.CorrelationEngine;
import com.threatintel.riskengine.domain.service.correlation.CorrelationProperties;
import com.threatintel.riskengine.domain.service.correlation.CorrelationRunRegistry;
import com.threatintel.riskengine.domain.service.correlation.CorrelationService;
import com.threatintel.riskengine.domain.service.correlation.EvidenceBuilder;
import com.threatintel.riskengine.domain.service.correlation.ThreadAssembler;
import com.threatintel.riskengine.domain.service.disagreement.DisagreementMonitor;
import com.threatintel.riskengine.domain.service.escalation.EscalationPolicy;
import com.threatintel.riskengine.domain.service.escalation.EscalationProperties;
import com.threatintel.riskengine.domain.service.scoring.RiskScoringService;
import com.threatintel.riskengine.domain.service.scoring.ScoringProperties;
import com.threatintel.riskengine.domain.service.scoring.SeverityTierMapper;
import com.threatintel.riskengine.domain.service.scoring.ThreadScorer;
import com.threatintel.riskengine.infra.metrics.CorrelationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.mockito.Mockito.mock;

/**
 * Hand-wired engine with default properties, for tests that do not need a Spring context.
 */
public final class EngineFixture {

    public final ScoringProperties scoringProperties = new ScoringProperties();
    public final CorrelationProperties correlationProperties = new CorrelationProperties();
    public final EscalationProperties escalationProperties = new EscalationProperties();

    public final SeverityTierMapper tierMapper = new SeverityTierMapper(scoringProperties);
    public final RiskScoringService scoringService = new RiskScoringService(scoringProperties, tierMapper);
    public final EvidenceBuilder evidenceBuilder = new EvidenceBuilder(correlationProperties);
    public final CorrelationEngine correlationEngine = new CorrelationEngine(evidenceBuilder);
    public final ThreadScorer threadScorer = new ThreadScorer(scoringProperties, tierMapper);
    public final EscalationPolicy escalationPolicy = new EscalationPolicy(escalationProperties);
    public final ThreadAssembler threadAssembler = new ThreadAssembler(threadScorer, escalationPolicy);

    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final CorrelationMetrics metrics = new CorrelationMetrics(meterRegistry);
    public final CorrelationRunRegistry runRegistry = new CorrelationRunRegistry();

    public final DisagreementRepository disagreementRepository = mock(DisagreementRepository.class);
    public final ComparisonRunRepository comparisonRunRepository = mock(ComparisonRunRepository.class);

    public final ExecutorService scoringExecutor = Executors.newFixedThreadPool(2);

    public DisagreementMonitor disagreementMonitor(SecondarySeveritySignal signal) {
        return new DisagreementMonitor(signal, disagreementRepository, comparisonRunRepository, metrics);
    }

    public CorrelationService correlationService(RecordSource source, ResultSink sink, SecondarySeveritySignal signal) {
        return new CorrelationService(source, sink, scoringService, correlationEngine, threadAssembler,
                disagreementMonitor(signal), runRegistry, correlationProperties, metrics, scoringExecutor);
    }

    public void shutdown() {
        scoringExecutor.shutdownNow();
    }
}
