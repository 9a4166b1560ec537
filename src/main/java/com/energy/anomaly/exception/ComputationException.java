package com.energy.anomaly.exception;

public class ComputationException extends AnalysisException {

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
