package com.threatintel.riskengine.domain.service.correlation;

import com.threatintel.riskengine.domain.model.PairEvidence;
import com.threatintel.riskengine.domain.model.Pivot;
import com.threatintel.riskengine.domain.model.ReasonCode;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.model.SourceType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Derives the reason codes and literal shared pivots of an admitted edge. The result
 * depends only on the two records' pivots, source types and timestamps.
 */
@Component
@RequiredArgsConstructor
public class EvidenceBuilder {

    private final CorrelationProperties properties;

    public PairEvidence build(SignalRecord a, SignalRecord b) {
        SignalRecord first = a.getId().compareTo(b.getId()) <= 0 ? a : b;
        SignalRecord second = first == a ? b : a;

        List<Pivot> shared = new ArrayList<>();
        for (Pivot pivot : first.getPivots()) {
            if (second.getPivots().contains(pivot)) shared.add(pivot);
        }
        Collections.sort(shared);

        Set<ReasonCode> codes = EnumSet.noneOf(ReasonCode.class);
        for (Pivot pivot : shared) {
            codes.add(ReasonCode.sharedPivot(pivot.type()));
        }

        SourceType typeA = first.resolvedSourceType();
        SourceType typeB = second.resolvedSourceType();
        if (typeA != null && typeB != null && typeA != typeB) {
            codes.add(ReasonCode.CROSS_SOURCE);
        }

        Duration delta = Duration.between(first.getTimestamp(), second.getTimestamp()).abs();
        if (delta.compareTo(tightThreshold()) <= 0) {
            codes.add(ReasonCode.TIGHT_TEMPORAL);
        }

        return new PairEvidence(first.getId(), second.getId(),
                Collections.unmodifiableSet(codes), List.copyOf(shared), delta.getSeconds());
    }

    Duration tightThreshold() {
        return Duration.ofMinutes(Math.max(0, properties.getTightTemporalMinutes()));
    }
}
