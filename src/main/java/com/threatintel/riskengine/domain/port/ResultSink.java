package com.threatintel.riskengine.domain.port;

import com.threatintel.riskengine.domain.model.CorrelationResult;
import com.threatintel.riskengine.domain.model.DisagreementBatch;

/**
 * Durable destination of correlation output.
 */
public interface ResultSink {

    /**
     * Replaces the stored thread set and record scores of the result's window in one step.
     * Readers observe either the previous complete set or the new one.
     */
    void replaceWindow(CorrelationResult result);

    /**
     * Appends disagreements, ignoring any whose (record id, run id) already exists.
     *
     * @return number of rows actually inserted
     */
    int appendDisagreements(DisagreementBatch batch);
}
