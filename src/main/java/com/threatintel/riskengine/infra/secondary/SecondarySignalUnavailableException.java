package com.threatintel.riskengine.infra.secondary;

public class SecondarySignalUnavailableException extends RuntimeException {

    public SecondarySignalUnavailableException(String message) {
        super(message);
    }

    public SecondarySignalUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
