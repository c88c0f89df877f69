package com.threatintel.riskengine.domain.service.correlation;

public class CorrelationRunAbortedException extends RuntimeException {

    public CorrelationRunAbortedException(String phase) {
        super("correlation run aborted during " + phase + ", nothing was written");
    }
}
