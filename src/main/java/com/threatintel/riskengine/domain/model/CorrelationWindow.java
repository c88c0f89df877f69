package com.threatintel.riskengine.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Parameters of one correlation run.
 */
public record CorrelationWindow(
        Instant start,
        Instant end,
        double windowHours,
        int minClusterSize
) {

    public CorrelationWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("window start and end are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("window end " + end + " is before start " + start);
        }
        if (!(windowHours >= 0) || Double.isInfinite(windowHours)) {
            throw new IllegalArgumentException("windowHours must be a non-negative number: " + windowHours);
        }
    }

    public Duration edgeGate() {
        return Duration.ofMillis(Math.round(windowHours * 3_600_000L));
    }

    public boolean overlaps(CorrelationWindow other) {
        return !start.isAfter(other.end) && !other.start.isAfter(end);
    }

    /** Key under which a window's result set is stored and replaced. */
    public String storageKey() {
        return start.toEpochMilli() + ":" + end.toEpochMilli();
    }
}
