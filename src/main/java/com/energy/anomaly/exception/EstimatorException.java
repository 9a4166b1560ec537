package com.energy.anomaly.exception;

/**
 * A statistical estimator cannot be fitted with the data and configuration given,
 * e.g. fewer rows than the configured neighbor count.
 */
public class EstimatorException extends AnalysisException {

    public EstimatorException(String message) {
        super(message);
    }

    public EstimatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
