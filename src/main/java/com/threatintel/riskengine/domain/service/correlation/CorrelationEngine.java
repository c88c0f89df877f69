package com.threatintel.riskengine.domain.service.correlation;

import com.threatintel.riskengine.domain.model.PairEvidence;
import com.threatintel.riskengine.domain.model.Pivot;
import com.threatintel.riskengine.domain.model.SignalRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups records into connected components over pivot-sharing edges.
 * <p>
 * Candidate pairs are only generated inside a pivot bucket, and only admitted when the
 * two timestamps are at most {@code gate} apart. Admitted edges are merged with
 * union-find, so membership is the transitive closure of the edge set and does not
 * depend on which record happens to be seen first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CorrelationEngine {

    private final EvidenceBuilder evidenceBuilder;

    public List<RecordCluster> cluster(PivotIndex index, Duration gate, int minClusterSize) {
        int minSize = Math.max(2, minClusterSize);

        List<SignalRecord> records = new ArrayList<>(index.records());
        Map<String, Integer> position = new HashMap<>(records.size() * 2);
        for (int i = 0; i < records.size(); i++) {
            position.put(records.get(i).getId(), i);
        }

        UnionFind unionFind = new UnionFind(records.size());
        TreeSet<EdgeKey> edges = new TreeSet<>();
        long candidatePairs = 0;

        for (Map.Entry<Pivot, List<SignalRecord>> bucket : index.candidateBuckets().entrySet()) {
            List<SignalRecord> members = bucket.getValue();
            for (int i = 0; i < members.size(); i++) {
                SignalRecord a = members.get(i);
                for (int j = i + 1; j < members.size(); j++) {
                    SignalRecord b = members.get(j);
                    // bucket is time ordered, later records are further away
                    if (Duration.between(a.getTimestamp(), b.getTimestamp()).compareTo(gate) > 0) break;
                    candidatePairs++;
                    if (edges.add(EdgeKey.of(a.getId(), b.getId()))) {
                        unionFind.union(position.get(a.getId()), position.get(b.getId()));
                    }
                }
            }
        }

        Map<Integer, List<SignalRecord>> components = new TreeMap<>();
        for (int i = 0; i < records.size(); i++) {
            components.computeIfAbsent(unionFind.find(i), k -> new ArrayList<>()).add(records.get(i));
        }

        Map<Integer, List<PairEvidence>> evidenceByRoot = new HashMap<>();
        for (EdgeKey edge : edges) {
            int root = unionFind.find(position.get(edge.a()));
            PairEvidence evidence = evidenceBuilder.build(index.record(edge.a()), index.record(edge.b()));
            evidenceByRoot.computeIfAbsent(root, k -> new ArrayList<>()).add(evidence);
        }

        List<RecordCluster> clusters = new ArrayList<>();
        int discarded = 0;
        for (Map.Entry<Integer, List<SignalRecord>> component : components.entrySet()) {
            List<SignalRecord> members = component.getValue();
            if (members.size() < minSize) {
                discarded++;
                continue;
            }
            members.sort(PivotIndex.TIME_ORDER);
            clusters.add(new RecordCluster(List.copyOf(members),
                    List.copyOf(evidenceByRoot.getOrDefault(component.getKey(), List.of()))));
        }

        log.debug("[Correlation] records={}, pivots={}, candidatePairs={}, edges={}, clusters={}, discarded={}",
                records.size(), index.pivotCount(), candidatePairs, edges.size(), clusters.size(), discarded);
        return clusters;
    }

    /**
     * Members in (timestamp, id) order and the evidence of every admitted edge between them,
     * ordered by record id pair.
     */
    public record RecordCluster(List<SignalRecord> members, List<PairEvidence> evidence) {

        public List<String> memberIds() {
            return members.stream().map(SignalRecord::getId).toList();
        }
    }

    record EdgeKey(String a, String b) implements Comparable<EdgeKey> {

        static EdgeKey of(String x, String y) {
            return x.compareTo(y) <= 0 ? new EdgeKey(x, y) : new EdgeKey(y, x);
        }

        @Override
        public int compareTo(EdgeKey other) {
            int cmp = a.compareTo(other.a);
            return cmp != 0 ? cmp : b.compareTo(other.b);
        }
    }

    static final class UnionFind {
        private final int[] parent;
        private final int[] rank;

        UnionFind(int size) {
            parent = new int[size];
            rank = new int[size];
            for (int i = 0; i < size; i++) parent[i] = i;
        }

        int find(int x) {
            int root = x;
            while (parent[root] != root) root = parent[root];
            while (parent[x] != root) {
                int next = parent[x];
                parent[x] = root;
                x = next;
            }
            return root;
        }

        void union(int x, int y) {
            int rx = find(x);
            int ry = find(y);
            if (rx == ry) return;
            if (rank[rx] < rank[ry]) {
                parent[rx] = ry;
            } else if (rank[rx] > rank[ry]) {
                parent[ry] = rx;
            } else {
                parent[ry] = rx;
                rank[rx]++;
            }
        }
    }
}
