package com.threatintel.riskengine.domain.service.correlation;

import com.threatintel.riskengine.domain.model.CorrelationWindow;
import lombok.Getter;

/**
 * Another run holds a window overlapping the requested one. The caller may retry once it finishes.
 */
@Getter
public class CorrelationRunInProgressException extends RuntimeException {

    private final CorrelationWindow requested;
    private final CorrelationWindow active;

    public CorrelationRunInProgressException(CorrelationWindow requested, CorrelationWindow active) {
        super("correlation run in progress for overlapping window " + active.start() + ".." + active.end());
        this.requested = requested;
        this.active = active;
    }

    public boolean isRetryable() {
        return true;
    }
}
