package com.threatintel.riskengine.domain.service.correlation;

public class ThreadNotFoundException extends RuntimeException {

    public ThreadNotFoundException(String threadId) {
        super("thread not found: " + threadId);
    }
}
