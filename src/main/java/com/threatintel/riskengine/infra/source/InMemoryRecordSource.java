package com.threatintel.riskengine.infra.source;

import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.port.RecordSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Record store fed by the intake API and the fixture loader. Re-submitting an id replaces
 * the stored record.
 * <p>
 * Records without a timestamp cannot be placed in a window; they are handed to every
 * window query so the engine can still score them.
 */
@Slf4j
@Component
public class InMemoryRecordSource implements RecordSource {

    private final ConcurrentMap<String, SignalRecord> records = new ConcurrentHashMap<>();

    public int addAll(Collection<SignalRecord> incoming) {
        int accepted = 0;
        for (SignalRecord record : incoming) {
            if (record == null || record.getId() == null || record.getId().isBlank()) {
                log.warn("[RecordSource] record without id rejected");
                continue;
            }
            records.put(record.getId(), record);
            accepted++;
        }
        return accepted;
    }

    @Override
    public List<SignalRecord> findInWindow(Instant start, Instant end) {
        List<SignalRecord> result = new ArrayList<>();
        for (SignalRecord record : records.values()) {
            Instant ts = record.getTimestamp();
            if (ts == null || (!ts.isBefore(start) && !ts.isAfter(end))) {
                result.add(record);
            }
        }
        return result;
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }
}
