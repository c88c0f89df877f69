package com.threatintel.riskengine.domain.service.correlation;

import com.threatintel.riskengine.domain.model.CorrelationThread;
import com.threatintel.riskengine.domain.model.EscalationDecision;
import com.threatintel.riskengine.domain.model.PairEvidence;
import com.threatintel.riskengine.domain.model.Pivot;
import com.threatintel.riskengine.domain.model.PivotType;
import com.threatintel.riskengine.domain.model.ReasonCode;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.service.correlation.CorrelationEngine.RecordCluster;
import com.threatintel.riskengine.domain.service.escalation.EscalationPolicy;
import com.threatintel.riskengine.domain.service.scoring.ThreadScorer;
import com.threatintel.riskengine.domain.service.scoring.ThreadScorer.ThreadScore;
import com.threatintel.riskengine.util.Hashing;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a scored record cluster into an analyst-facing thread.
 */
@Component
@RequiredArgsConstructor
public class ThreadAssembler {

    private static final int THREAD_ID_HEX_CHARS = 16;

    private final ThreadScorer threadScorer;
    private final EscalationPolicy escalationPolicy;

    public List<CorrelationThread> assemble(List<RecordCluster> clusters) {
        return clusters.stream()
                .map(this::assemble)
                .sorted(Comparator.comparing(CorrelationThread::windowStart)
                        .thenComparing(CorrelationThread::threadId))
                .toList();
    }

    public CorrelationThread assemble(RecordCluster cluster) {
        List<SignalRecord> members = cluster.members();
        List<String> memberIds = cluster.memberIds();
        List<PairEvidence> evidence = cluster.evidence();

        String threadId = threadId(memberIds);
        Map<Pivot, Integer> sharedPivots = sharedPivots(members);

        Set<ReasonCode> reasonCodes = EnumSet.noneOf(ReasonCode.class);
        evidence.forEach(e -> reasonCodes.addAll(e.reasonCodes()));

        Instant start = members.get(0).getTimestamp();
        Instant end = members.get(members.size() - 1).getTimestamp();

        ThreadScore score = threadScorer.score(members, evidence);
        EscalationDecision escalation = escalationPolicy.decide(score.getRecommendedTier(), score.getConfidence());

        return CorrelationThread.builder()
                .threadId(threadId)
                .label(label(threadId, sharedPivots))
                .memberIds(memberIds)
                .memberCount(memberIds.size())
                .sourceTypes(score.getSourceTypes())
                .windowStart(start)
                .windowEnd(end)
                .sharedPivots(List.copyOf(sharedPivots.keySet()))
                .reasonCodes(Collections.unmodifiableSet(reasonCodes))
                .evidence(evidence)
                .aggregateScore(score.getAggregateScore())
                .maxScoreByDimension(score.getMaxScoreByDimension())
                .confidence(score.getConfidence())
                .scoreTier(score.getScoreTier())
                .recommendedTier(score.getRecommendedTier())
                .escalation(escalation)
                .build();
    }

    /** Stable id: hash of the sorted member id list. */
    public static String threadId(List<String> memberIds) {
        String joined = String.join(",", memberIds.stream().sorted().toList());
        return Hashing.shortId("thr-", joined, THREAD_ID_HEX_CHARS);
    }

    /** Pivots carried by at least two members, with the number of members carrying each. */
    static Map<Pivot, Integer> sharedPivots(List<SignalRecord> members) {
        Map<Pivot, Integer> counts = new TreeMap<>();
        for (SignalRecord member : members) {
            for (Pivot pivot : member.getPivots()) {
                counts.merge(pivot, 1, Integer::sum);
            }
        }
        counts.values().removeIf(count -> count < 2);
        return counts;
    }

    /**
     * An actor handle names the thread when one is shared, otherwise the pivot shared by the
     * most members.
     */
    static String label(String threadId, Map<Pivot, Integer> sharedPivots) {
        for (Pivot pivot : sharedPivots.keySet()) {
            if (pivot.type() == PivotType.ACTOR_HANDLE) return pivot.value();
        }
        return sharedPivots.entrySet().stream()
                .max(Map.Entry.<Pivot, Integer>comparingByValue()
                        .thenComparing(Map.Entry.<Pivot, Integer>comparingByKey().reversed()))
                .map(e -> e.getKey().literal())
                .orElse(threadId);
    }
}
