package com.alerting.aggregation.api;

/**
 * Thrown when an operation names a strategy id that does not exist.
 * Handler returns HTTP 404.
 */
public class StrategyNotFoundException extends RuntimeException {

    public StrategyNotFoundException(Long strategyId) {
        super("Strategy not found: " + strategyId);
    }
}
