package com.alerting.aggregation.aggregation.engine;

/**
 * Failure inside the embedded analytical engine: connection problems or a generated query
 * the engine rejects. Not retried locally.
 */
public class AnalyticalEngineException extends RuntimeException {

    public AnalyticalEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
