package com.threatintel.riskengine.domain.service.disagreement;

import com.threatintel.riskengine.domain.model.AnalystVerdict;
import com.threatintel.riskengine.domain.model.ComparisonRunRecord;
import com.threatintel.riskengine.domain.model.DisagreementBatch;
import com.threatintel.riskengine.domain.model.DisagreementRecord;
import com.threatintel.riskengine.domain.model.ScoreDimension;
import com.threatintel.riskengine.domain.model.ScoreResult;
import com.threatintel.riskengine.domain.model.SeverityTier;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.port.SecondarySeveritySignal;
import com.threatintel.riskengine.support.EngineFixture;
import com.threatintel.riskengine.support.TestRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DisagreementMonitor")
class DisagreementMonitorTest {

    private static final String RUN = "run-0123456789abcdef";

    private final EngineFixture fixture = new EngineFixture();

    @AfterEach
    void tearDown() {
        fixture.shutdown();
    }

    private static SignalRecord scored(String id, SeverityTier tier, double score) {
        return TestRecords.scenarioInsider().toBuilder().id(id).build()
                .withScore(new ScoreResult(ScoreDimension.INSIDER, score, tier, List.of(), false, true));
    }

    private static SecondarySeveritySignal labels(Map<String, SeverityTier> tiers) {
        return recordId -> Optional.ofNullable(tiers.get(recordId));
    }

    @Nested
    @DisplayName("compare")
    class Compare {

        @Test
        @DisplayName("a tier mismatch becomes a disagreement keyed by record and run")
        void mismatch() {
            DisagreementMonitor monitor = fixture.disagreementMonitor(labels(Map.of("r1", SeverityTier.ELEVATED)));

            DisagreementBatch batch = monitor.compare(RUN, List.of(scored("r1", SeverityTier.HIGH, 81.0)));

            assertThat(batch.comparedCount()).isEqualTo(1);
            assertThat(batch.disagreements()).singleElement().satisfies(d -> {
                assertThat(d.getRecordId()).isEqualTo("r1");
                assertThat(d.getRunId()).isEqualTo(RUN);
                assertThat(d.getRulesTier()).isEqualTo(SeverityTier.HIGH);
                assertThat(d.getSecondaryTier()).isEqualTo(SeverityTier.ELEVATED);
                assertThat(d.getRulesScore()).isEqualTo(81.0);
                assertThat(d.getAnalystVerdict()).isNull();
            });
        }

        @Test
        @DisplayName("equal tiers count as compared without a disagreement")
        void agreement() {
            DisagreementMonitor monitor = fixture.disagreementMonitor(labels(Map.of("r1", SeverityTier.HIGH)));

            DisagreementBatch batch = monitor.compare(RUN, List.of(scored("r1", SeverityTier.HIGH, 81.0)));

            assertThat(batch.comparedCount()).isEqualTo(1);
            assertThat(batch.disagreements()).isEmpty();
        }

        @Test
        @DisplayName("no secondary tier means no comparison")
        void absent() {
            DisagreementMonitor monitor = fixture.disagreementMonitor(SecondarySeveritySignal.NONE);

            DisagreementBatch batch = monitor.compare(RUN, List.of(scored("r1", SeverityTier.HIGH, 81.0)));

            assertThat(batch.comparedCount()).isZero();
            assertThat(batch.disagreements()).isEmpty();
        }

        @Test
        @DisplayName("unscored records are not compared")
        void unscored() {
            DisagreementMonitor monitor = fixture.disagreementMonitor(labels(Map.of("ins-001", SeverityTier.LOW)));

            DisagreementBatch batch = monitor.compare(RUN, List.of(TestRecords.scenarioInsider()));

            assertThat(batch.comparedCount()).isZero();
        }

        @Test
        @DisplayName("a failing secondary lookup is counted and treated as absent")
        void failingLookup() {
            DisagreementMonitor monitor = fixture.disagreementMonitor(recordId -> {
                throw new IllegalStateException("timeout");
            });

            DisagreementBatch batch = monitor.compare(RUN, List.of(
                    scored("r1", SeverityTier.HIGH, 81.0),
                    scored("r2", SeverityTier.LOW, 12.0)));

            assertThat(batch.comparedCount()).isZero();
            assertThat(fixture.meterRegistry.counter("secondary.signal.failures").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("a label attached to the record wins over the collaborator")
        void recordLabelPreferred() {
            DisagreementMonitor monitor = fixture.disagreementMonitor(labels(Map.of("r1", SeverityTier.HIGH)));
            SignalRecord labelled = scored("r1", SeverityTier.HIGH, 81.0).toBuilder()
                    .secondaryTier(SeverityTier.GUARDED)
                    .build();

            DisagreementBatch batch = monitor.compare(RUN, List.of(labelled));

            assertThat(batch.disagreements()).singleElement()
                    .extracting(DisagreementRecord::getSecondaryTier)
                    .isEqualTo(SeverityTier.GUARDED);
        }
    }

    @Nested
    @DisplayName("disagreementRate")
    class Rate {

        @Test
        @DisplayName("mismatches over compared records")
        void rate() {
            when(fixture.comparisonRunRepository.findByRunId(RUN))
                    .thenReturn(Optional.of(ComparisonRunRecord.builder().runId(RUN).comparedCount(4).build()));
            when(fixture.disagreementRepository.countByRunId(RUN)).thenReturn(1L);

            assertThat(fixture.disagreementMonitor(SecondarySeveritySignal.NONE).disagreementRate(RUN))
                    .isEqualTo(0.25);
        }

        @Test
        @DisplayName("unknown run reads as zero")
        void unknownRun() {
            when(fixture.comparisonRunRepository.findByRunId("run-missing")).thenReturn(Optional.empty());

            assertThat(fixture.disagreementMonitor(SecondarySeveritySignal.NONE).disagreementRate("run-missing"))
                    .isZero();
            verify(fixture.disagreementRepository, never()).countByRunId(any());
        }
    }

    @Nested
    @DisplayName("adjudicate")
    class Adjudicate {

        @Test
        @DisplayName("fills the verdict and adjudication time")
        void verdict() {
            DisagreementRecord row = DisagreementRecord.builder().id(7L).recordId("r1").runId(RUN).build();
            when(fixture.disagreementRepository.findById(7L)).thenReturn(Optional.of(row));
            when(fixture.disagreementRepository.save(row)).thenReturn(row);

            DisagreementRecord saved = fixture.disagreementMonitor(SecondarySeveritySignal.NONE)
                    .adjudicate(7L, AnalystVerdict.SECONDARY_CORRECT);

            assertThat(saved.getAnalystVerdict()).isEqualTo(AnalystVerdict.SECONDARY_CORRECT);
            assertThat(saved.getAdjudicatedAtEpochMs()).isNotNull();
        }

        @Test
        @DisplayName("unknown id is reported as not found")
        void unknownId() {
            when(fixture.disagreementRepository.findById(99L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> fixture.disagreementMonitor(SecondarySeveritySignal.NONE)
                    .adjudicate(99L, AnalystVerdict.RULES_CORRECT))
                    .isInstanceOf(DisagreementNotFoundException.class);
        }

        @Test
        @DisplayName("a verdict is required")
        void missingVerdict() {
            assertThatThrownBy(() -> fixture.disagreementMonitor(SecondarySeveritySignal.NONE).adjudicate(7L, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
