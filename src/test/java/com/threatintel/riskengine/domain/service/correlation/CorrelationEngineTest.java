package com.threatintel.riskengine.domain.service.correlation;

import com.threatintel.riskengine.domain.model.Pivot;
import com.threatintel.riskengine.domain.model.PivotType;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.service.correlation.CorrelationEngine.RecordCluster;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.threatintel.riskengine.support.TestRecords.at;
import static com.threatintel.riskengine.support.TestRecords.external;
import static com.threatintel.riskengine.support.TestRecords.insider;
import static com.threatintel.riskengine.support.TestRecords.pivot;
import static com.threatintel.riskengine.support.TestRecords.vendor;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CorrelationEngine")
class CorrelationEngineTest {

    private static final Duration GATE = Duration.ofHours(72);

    private static final Pivot USER = pivot(PivotType.USER_ID, "emp-7415");
    private static final Pivot VENDOR = pivot(PivotType.VENDOR_ID, "sc-004");

    private final CorrelationEngine engine = new CorrelationEngine(new EvidenceBuilder(new CorrelationProperties()));

    private List<RecordCluster> cluster(List<SignalRecord> records, Duration gate, int minSize) {
        return engine.cluster(PivotIndex.build(records), gate, minSize);
    }

    @Nested
    @DisplayName("Connectivity")
    class Connectivity {

        @Test
        @DisplayName("A-B on user_id and B-C on vendor_id form one thread of three")
        void transitive() {
            SignalRecord a = insider("A", at(Duration.ZERO), USER);
            SignalRecord b = external("B", at(Duration.ofHours(1)), USER, VENDOR);
            SignalRecord c = vendor("C", at(Duration.ofHours(2)), VENDOR);

            List<RecordCluster> clusters = cluster(List.of(c, a, b), GATE, 2);

            assertThat(clusters).hasSize(1);
            assertThat(clusters.get(0).memberIds()).containsExactly("A", "B", "C");
            assertThat(clusters.get(0).evidence())
                    .extracting(e -> e.recordA() + "-" + e.recordB())
                    .containsExactly("A-B", "B-C");
        }

        @Test
        @DisplayName("a record sharing no pivot stays out of every thread")
        void isolation() {
            SignalRecord a = external("A", at(Duration.ZERO), USER);
            SignalRecord b = external("B", at(Duration.ofHours(1)), USER);
            SignalRecord loner = external("L", at(Duration.ofMinutes(30)), pivot(PivotType.DOMAIN, "elsewhere.example"));

            List<RecordCluster> clusters = cluster(List.of(a, b, loner), GATE, 2);

            assertThat(clusters).hasSize(1);
            assertThat(clusters.get(0).memberIds()).doesNotContain("L");
        }

        @Test
        @DisplayName("records without pivots never link")
        void zeroPivots() {
            List<RecordCluster> clusters = cluster(List.of(
                    external("A", at(Duration.ZERO)),
                    external("B", at(Duration.ZERO))), GATE, 2);

            assertThat(clusters).isEmpty();
        }

        @Test
        @DisplayName("several shared pivots produce one edge with all of them")
        void oneEdgePerPair() {
            SignalRecord a = external("A", at(Duration.ZERO), USER, VENDOR);
            SignalRecord b = external("B", at(Duration.ofHours(1)), USER, VENDOR);

            List<RecordCluster> clusters = cluster(List.of(a, b), GATE, 2);

            assertThat(clusters.get(0).evidence()).hasSize(1);
            assertThat(clusters.get(0).evidence().get(0).sharedPivots()).containsExactly(USER, VENDOR);
        }

        @Test
        @DisplayName("empty input gives no threads")
        void empty() {
            assertThat(cluster(List.of(), GATE, 2)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Temporal gate")
    class TemporalGate {

        @Test
        @DisplayName("admits an edge at exactly the gate and rejects it beyond")
        void inclusiveGate() {
            SignalRecord a = external("A", at(Duration.ZERO), USER);
            SignalRecord b = external("B", at(Duration.ofHours(5)), USER);

            assertThat(cluster(List.of(a, b), Duration.ofHours(5), 2)).hasSize(1);
            assertThat(cluster(List.of(a, b), Duration.ofHours(4), 2)).isEmpty();
        }

        @Test
        @DisplayName("chains across the gate through intermediate records")
        void chainAcrossGate() {
            SignalRecord a = external("A", at(Duration.ZERO), USER);
            SignalRecord b = external("B", at(Duration.ofHours(3)), USER);
            SignalRecord c = external("C", at(Duration.ofHours(6)), USER);

            List<RecordCluster> clusters = cluster(List.of(a, b, c), Duration.ofHours(4), 2);

            assertThat(clusters).hasSize(1);
            assertThat(clusters.get(0).memberIds()).containsExactly("A", "B", "C");
            assertThat(clusters.get(0).evidence()).hasSize(2);
        }

        @Test
        @DisplayName("widening the gate never removes or splits a thread")
        void monotonicity() {
            List<SignalRecord> records = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                Pivot shared = pivot(PivotType.USER_ID, "u" + (i % 3));
                Pivot other = pivot(PivotType.DOMAIN, "d" + (i % 4) + ".example");
                records.add(external("r" + i, at(Duration.ofHours(i * 5L)), shared, other));
            }

            List<RecordCluster> narrow = cluster(records, Duration.ofHours(10), 2);
            List<RecordCluster> wide = cluster(records, Duration.ofHours(30), 2);

            for (RecordCluster small : narrow) {
                assertThat(wide)
                        .anySatisfy(big -> assertThat(big.memberIds()).containsAll(small.memberIds()));
            }
        }
    }

    @Nested
    @DisplayName("Cluster size")
    class ClusterSize {

        @Test
        @DisplayName("components below the minimum size are discarded")
        void minimumSize() {
            SignalRecord a = external("A", at(Duration.ZERO), USER);
            SignalRecord b = external("B", at(Duration.ofHours(1)), USER);

            assertThat(cluster(List.of(a, b), GATE, 3)).isEmpty();
            assertThat(cluster(List.of(a, b), GATE, 2)).hasSize(1);
        }

        @Test
        @DisplayName("singletons are never emitted even with a minimum of one")
        void noSingletons() {
            assertThat(cluster(List.of(external("A", at(Duration.ZERO), USER)), GATE, 1)).isEmpty();
        }
    }

    @Test
    @DisplayName("same records in a different order give the same clusters")
    void deterministic() {
        SignalRecord a = insider("A", at(Duration.ZERO), USER);
        SignalRecord b = external("B", at(Duration.ofHours(1)), USER, VENDOR);
        SignalRecord c = vendor("C", at(Duration.ofHours(2)), VENDOR);

        assertThat(cluster(List.of(a, b, c), GATE, 2)).isEqualTo(cluster(List.of(c, b, a), GATE, 2));
    }
}
