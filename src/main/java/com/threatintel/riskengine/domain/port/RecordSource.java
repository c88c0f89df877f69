package com.threatintel.riskengine.domain.port;

import com.threatintel.riskengine.domain.model.SignalRecord;

import java.time.Instant;
import java.util.List;

/**
 * Supplies the normalised records of a bounded time window. Records without a timestamp
 * may still be returned; the engine scores them but keeps them out of clustering.
 */
public interface RecordSource {

    List<SignalRecord> findInWindow(Instant start, Instant end);
}
