package com.energy.anomaly.exception;

/**
 * Base type for failures of an analysis run. The message is user-facing: it is
 * rendered verbatim into the {@code {"error": ...}} result.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
