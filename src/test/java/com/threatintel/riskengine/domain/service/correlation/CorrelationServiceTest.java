package com.threatintel.riskengine.domain.service.correlation;

import com.threatintel.riskengine.domain.model.CorrelationResult;
import com.threatintel.riskengine.domain.model.CorrelationThread;
import com.threatintel.riskengine.domain.model.CorrelationWindow;
import com.threatintel.riskengine.domain.model.DisagreementBatch;
import com.threatintel.riskengine.domain.model.PivotType;
import com.threatintel.riskengine.domain.model.ReasonCode;
import com.threatintel.riskengine.domain.model.SeverityTier;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.port.RecordSource;
import com.threatintel.riskengine.domain.port.ResultSink;
import com.threatintel.riskengine.domain.port.SecondarySeveritySignal;
import com.threatintel.riskengine.domain.service.correlation.CorrelationRunRegistry.RunLease;
import com.threatintel.riskengine.support.EngineFixture;
import com.threatintel.riskengine.support.TestRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.threatintel.riskengine.support.TestRecords.at;
import static com.threatintel.riskengine.support.TestRecords.external;
import static com.threatintel.riskengine.support.TestRecords.pivot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("CorrelationService")
class CorrelationServiceTest {

    private static final Instant START = Instant.parse("2026-03-10T00:00:00Z");
    private static final Instant END = Instant.parse("2026-03-13T00:00:00Z");

    private EngineFixture fixture;
    private RecordSource source;
    private ResultSink sink;
    private CorrelationService service;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        source = mock(RecordSource.class);
        sink = mock(ResultSink.class);
        service = fixture.correlationService(source, sink, SecondarySeveritySignal.NONE);
    }

    @AfterEach
    void tearDown() {
        fixture.shutdown();
    }

    @Nested
    @DisplayName("Scenario")
    class Scenario {

        @Test
        @DisplayName("insider, external and vendor records form one CRITICAL thread")
        void crossSourceThread() {
            when(source.findInWindow(START, END)).thenReturn(TestRecords.scenario());

            CorrelationResult result = service.correlate(START, END, 72.0, 2);

            assertThat(result.threads()).hasSize(1);
            CorrelationThread thread = result.threads().get(0);
            assertThat(thread.memberIds()).containsExactly("ins-001", "ext-001", "ven-001");
            assertThat(thread.reasonCodes()).contains(
                    ReasonCode.SHARED_USER_ID, ReasonCode.SHARED_VENDOR_ID,
                    ReasonCode.CROSS_SOURCE, ReasonCode.TIGHT_TEMPORAL);
            assertThat(thread.recommendedTier()).isEqualTo(SeverityTier.CRITICAL);
            assertThat(thread.label()).isEqualTo("user_id:emp-7415");
        }

        @Test
        @DisplayName("returns every record scored")
        void scoredRecords() {
            when(source.findInWindow(START, END)).thenReturn(TestRecords.scenario());

            CorrelationResult result = service.correlate(START, END, 72.0, 2);

            assertThat(result.scoredRecords())
                    .extracting(SignalRecord::getId, SignalRecord::getRiskScore, SignalRecord::getSeverityTier)
                    .containsExactly(
                            org.assertj.core.groups.Tuple.tuple("ins-001", 81.0, SeverityTier.HIGH),
                            org.assertj.core.groups.Tuple.tuple("ext-001", 55.7, SeverityTier.ELEVATED),
                            org.assertj.core.groups.Tuple.tuple("ven-001", 65.0, SeverityTier.ELEVATED));
            assertThat(result.scoredRecords().get(2).getVendorFlagged()).isTrue();
            assertThat(result.scoredRecords().get(0).getVendorFlagged()).isNull();
        }

        @Test
        @DisplayName("hands the result to the sink in one replace")
        void writesOnce() {
            when(source.findInWindow(START, END)).thenReturn(TestRecords.scenario());

            CorrelationResult result = service.correlate(START, END, 72.0, 2);

            verify(sink, times(1)).replaceWindow(result);
            verify(sink, times(1)).appendDisagreements(any(DisagreementBatch.class));
        }

        @Test
        @DisplayName("defaults apply when window hours and cluster size are omitted")
        void defaults() {
            when(source.findInWindow(START, END)).thenReturn(TestRecords.scenario());

            CorrelationResult result = service.correlate(START, END, null, null);

            assertThat(result.window().windowHours()).isEqualTo(72.0);
            assertThat(result.window().minClusterSize()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Repeatability")
    class Repeatability {

        @Test
        @DisplayName("identical input gives an identical result and run id")
        void deterministic() {
            when(source.findInWindow(START, END)).thenReturn(TestRecords.scenario());

            CorrelationResult first = service.correlate(START, END, 72.0, 2);
            CorrelationResult second = service.correlate(START, END, 72.0, 2);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("input order does not change thread ids or membership")
        void orderIndependent() {
            List<SignalRecord> reversed = new ArrayList<>(TestRecords.scenario());
            java.util.Collections.reverse(reversed);
            when(source.findInWindow(START, END)).thenReturn(TestRecords.scenario(), reversed);

            CorrelationResult first = service.correlate(START, END, 72.0, 2);
            CorrelationResult second = service.correlate(START, END, 72.0, 2);

            assertThat(second.threads()).isEqualTo(first.threads());
            assertThat(second.runId()).isEqualTo(first.runId());
        }

        @Test
        @DisplayName("a changed tier changes the run id")
        void runIdTracksData() {
            SignalRecord hotter = TestRecords.scenarioVendor().toBuilder()
                    .features(new com.threatintel.riskengine.domain.model.VendorFeatures(1, 1, 1, 1, 1))
                    .build();
            when(source.findInWindow(START, END)).thenReturn(
                    TestRecords.scenario(),
                    List.of(TestRecords.scenarioInsider(), TestRecords.scenarioExternal(), hotter));

            String first = service.correlate(START, END, 72.0, 2).runId();
            String second = service.correlate(START, END, 72.0, 2).runId();

            assertThat(second).isNotEqualTo(first);
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class Malformed {

        @Test
        @DisplayName("records without timestamp or pivots are scored but kept out of clustering")
        void skippedButScored() {
            SignalRecord noPivots = TestRecords.scenarioInsider().toBuilder().id("ins-009").pivots(null).build();
            SignalRecord noTimestamp = TestRecords.scenarioExternal().toBuilder().id("ext-009").timestamp(null).build();
            List<SignalRecord> records = new ArrayList<>(TestRecords.scenario());
            records.add(noPivots);
            records.add(noTimestamp);
            when(source.findInWindow(START, END)).thenReturn(records);

            CorrelationResult result = service.correlate(START, END, 72.0, 2);

            assertThat(result.skippedRecordIds()).containsExactly("ins-009", "ext-009");
            assertThat(result.threads()).hasSize(1);
            assertThat(result.threads().get(0).memberIds()).doesNotContain("ins-009", "ext-009");
            assertThat(result.scoredRecords()).filteredOn(r -> r.getId().equals("ins-009"))
                    .singleElement()
                    .satisfies(r -> assertThat(r.getRiskScore()).isEqualTo(81.0));
        }

        @Test
        @DisplayName("records without id or with a repeated id are dropped")
        void idsCleaned() {
            SignalRecord noId = TestRecords.scenarioVendor().toBuilder().id(null).build();
            List<SignalRecord> records = new ArrayList<>(TestRecords.scenario());
            records.add(noId);
            records.add(TestRecords.scenarioExternal());
            when(source.findInWindow(START, END)).thenReturn(records);

            CorrelationResult result = service.correlate(START, END, 72.0, 2);

            assertThat(result.scoredRecords()).extracting(SignalRecord::getId)
                    .containsExactly("ins-001", "ext-001", "ven-001");
        }

        @Test
        @DisplayName("an unscorable payload leaves the record unscored without failing the run")
        void unscorable() {
            SignalRecord bare = external("ext-010", at(Duration.ofMinutes(10)), pivot(PivotType.USER_ID, "emp-7415"))
                    .toBuilder().features(null).build();
            List<SignalRecord> records = new ArrayList<>(TestRecords.scenario());
            records.add(bare);
            when(source.findInWindow(START, END)).thenReturn(records);

            CorrelationResult result = service.correlate(START, END, 72.0, 2);

            assertThat(result.scoredRecords()).filteredOn(r -> r.getId().equals("ext-010"))
                    .singleElement()
                    .satisfies(r -> assertThat(r.isScored()).isFalse());
            assertThat(result.threads().get(0).memberIds()).contains("ext-010");
        }

        @Test
        @DisplayName("an empty window is a valid empty result")
        void emptyWindow() {
            when(source.findInWindow(START, END)).thenReturn(List.of());

            CorrelationResult result = service.correlate(START, END, 72.0, 2);

            assertThat(result.threads()).isEmpty();
            assertThat(result.scoredRecords()).isEmpty();
            verify(sink).replaceWindow(result);
        }

        @Test
        @DisplayName("invalid window parameters are rejected before any read")
        void invalidWindow() {
            assertThatThrownBy(() -> service.correlate(END, START, 72.0, 2))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.correlate(START, END, -1.0, 2))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(source, sink);
        }
    }

    @Nested
    @DisplayName("Run control")
    class RunControl {

        @Test
        @DisplayName("an overlapping run in progress rejects the request without writing")
        void overlappingRun() {
            try (RunLease ignored = fixture.runRegistry.acquire(new CorrelationWindow(START, END, 72, 2))) {
                assertThatThrownBy(() -> service.correlate(START.plusSeconds(3600), END, 72.0, 2))
                        .isInstanceOf(CorrelationRunInProgressException.class);
            }
            verifyNoInteractions(source, sink);
            assertThat(fixture.meterRegistry.counter("correlation.run.rejected").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("a cancelled run writes nothing and releases its window")
        void cancelled() {
            when(source.findInWindow(START, END)).thenAnswer(invocation -> {
                fixture.runRegistry.cancelOverlapping(new CorrelationWindow(START, END, 0, 2));
                return TestRecords.scenario();
            });

            assertThatThrownBy(() -> service.correlate(START, END, 72.0, 2))
                    .isInstanceOf(CorrelationRunAbortedException.class);
            verifyNoInteractions(sink);
            assertThat(fixture.runRegistry.activeWindows()).isEmpty();
        }

        @Test
        @DisplayName("the window is released after a successful run")
        void released() {
            when(source.findInWindow(START, END)).thenReturn(TestRecords.scenario());

            service.correlate(START, END, 72.0, 2);

            assertThat(fixture.runRegistry.activeWindows()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Secondary signal")
    class Secondary {

        @Test
        @DisplayName("mismatching tiers are handed to the sink under the run id")
        void mismatchesAppended() {
            SignalRecord labelled = TestRecords.scenarioInsider().toBuilder().secondaryTier(SeverityTier.ELEVATED).build();
            when(source.findInWindow(START, END)).thenReturn(
                    List.of(labelled, TestRecords.scenarioExternal(), TestRecords.scenarioVendor()));

            CorrelationResult result = service.correlate(START, END, 72.0, 2);

            ArgumentCaptor<DisagreementBatch> captor = ArgumentCaptor.forClass(DisagreementBatch.class);
            verify(sink).appendDisagreements(captor.capture());
            DisagreementBatch batch = captor.getValue();
            assertThat(batch.runId()).isEqualTo(result.runId());
            assertThat(batch.comparedCount()).isEqualTo(1);
            assertThat(batch.disagreements()).singleElement().satisfies(d -> {
                assertThat(d.getRecordId()).isEqualTo("ins-001");
                assertThat(d.getRulesTier()).isEqualTo(SeverityTier.HIGH);
                assertThat(d.getSecondaryTier()).isEqualTo(SeverityTier.ELEVATED);
            });
            assertThat(result.disagreementCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("a failing secondary signal does not affect threads or scores")
        void failingSignal() {
            SecondarySeveritySignal broken = recordId -> {
                throw new IllegalStateException("classifier offline");
            };
            CorrelationService withBrokenSignal = fixture.correlationService(source, sink, broken);
            when(source.findInWindow(START, END)).thenReturn(TestRecords.scenario());

            CorrelationResult expected = service.correlate(START, END, 72.0, 2);
            CorrelationResult actual = withBrokenSignal.correlate(START, END, 72.0, 2);

            assertThat(actual.threads()).isEqualTo(expected.threads());
            assertThat(actual.scoredRecords()).isEqualTo(expected.scoredRecords());
            assertThat(actual.comparedCount()).isZero();
        }

        @Test
        @DisplayName("the collaborator is consulted only for records without their own label")
        void recordLabelWins() {
            SecondarySeveritySignal signal = mock(SecondarySeveritySignal.class);
            when(signal.tierFor(any())).thenReturn(Optional.empty());
            SignalRecord labelled = TestRecords.scenarioInsider().toBuilder().secondaryTier(SeverityTier.HIGH).build();
            when(source.findInWindow(START, END)).thenReturn(
                    List.of(labelled, TestRecords.scenarioExternal(), TestRecords.scenarioVendor()));

            fixture.correlationService(source, sink, signal).correlate(START, END, 72.0, 2);

            verify(signal, never()).tierFor("ins-001");
            verify(signal).tierFor("ext-001");
        }
    }

    @Test
    @DisplayName("single-record scoring matches the scoring engine")
    void scoreDelegates() {
        assertThat(service.score(TestRecords.scenarioInsider()).score()).isEqualTo(81.0);
    }
}
