package com.threatintel.riskengine.domain.service.correlation;

import com.threatintel.riskengine.domain.model.Pivot;
import com.threatintel.riskengine.domain.model.SignalRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Per-run mapping from each pivot to the records carrying it.
 * <p>
 * Built once from the run's record set and read-only afterwards. Buckets keep their records
 * ordered by (timestamp, id) so the correlation pass can stop scanning a bucket as soon as
 * the temporal gate is exceeded. Records without pivots are only registered by id.
 */
public final class PivotIndex {

    static final Comparator<SignalRecord> TIME_ORDER = Comparator
            .comparing(SignalRecord::getTimestamp)
            .thenComparing(SignalRecord::getId);

    private final Map<String, SignalRecord> recordsById;
    private final Map<Pivot, List<SignalRecord>> buckets;
    private final Set<String> unpivotedIds;

    private PivotIndex(Map<String, SignalRecord> recordsById,
                       Map<Pivot, List<SignalRecord>> buckets,
                       Set<String> unpivotedIds) {
        this.recordsById = recordsById;
        this.buckets = buckets;
        this.unpivotedIds = unpivotedIds;
    }

    /**
     * @param records correlatable records (id, timestamp and pivot set present); ids must be unique
     */
    public static PivotIndex build(Collection<SignalRecord> records) {
        Map<String, SignalRecord> byId = new LinkedHashMap<>();
        Map<Pivot, List<SignalRecord>> buckets = new TreeMap<>();
        Set<String> unpivoted = new TreeSet<>();

        for (SignalRecord record : records) {
            if (!record.isCorrelatable()) {
                throw new IllegalArgumentException("record is not correlatable: " + record.getId());
            }
            if (byId.putIfAbsent(record.getId(), record) != null) {
                throw new IllegalArgumentException("duplicate record id: " + record.getId());
            }
            if (record.getPivots().isEmpty()) {
                unpivoted.add(record.getId());
                continue;
            }
            for (Pivot pivot : record.getPivots()) {
                buckets.computeIfAbsent(pivot, k -> new ArrayList<>()).add(record);
            }
        }

        Map<Pivot, List<SignalRecord>> frozen = new TreeMap<>();
        buckets.forEach((pivot, members) -> {
            members.sort(TIME_ORDER);
            frozen.put(pivot, Collections.unmodifiableList(members));
        });

        return new PivotIndex(Collections.unmodifiableMap(byId),
                Collections.unmodifiableMap(frozen),
                Collections.unmodifiableSet(unpivoted));
    }

    public List<SignalRecord> recordsFor(Pivot pivot) {
        return buckets.getOrDefault(pivot, List.of());
    }

    /** Buckets holding at least two records, in pivot order. */
    public Map<Pivot, List<SignalRecord>> candidateBuckets() {
        Map<Pivot, List<SignalRecord>> result = new TreeMap<>();
        buckets.forEach((pivot, members) -> {
            if (members.size() >= 2) result.put(pivot, members);
        });
        return result;
    }

    public SignalRecord record(String id) {
        return recordsById.get(id);
    }

    public Collection<SignalRecord> records() {
        return recordsById.values();
    }

    public Set<String> unpivotedIds() {
        return unpivotedIds;
    }

    public int pivotCount() {
        return buckets.size();
    }

    public int size() {
        return recordsById.size();
    }
}
