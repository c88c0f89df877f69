package com.threatintel.riskengine.domain.service.disagreement;

public class DisagreementNotFoundException extends RuntimeException {

    public DisagreementNotFoundException(Long id) {
        super("disagreement not found: " + id);
    }
}
