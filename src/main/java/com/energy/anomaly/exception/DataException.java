package com.energy.anomaly.exception;

/**
 * Malformed, empty or non-numeric input.
 */
public class DataException extends AnalysisException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
