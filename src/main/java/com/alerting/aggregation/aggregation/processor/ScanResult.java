package com.alerting.aggregation.aggregation.processor;

/**
 * Summary of one strategy scan.
 *
 * @param eventsInWindow CREATED events in the strategy's window before match rules
 * @param eventsMatched events left after match rules
 * @param groups grouped rows across all dimension sets tried
 */
public record ScanResult(Long strategyId, Outcome outcome, int eventsInWindow, int eventsMatched, int groups,
                         int created, int updated, int recovered) {

    public enum Outcome {
        COMPLETED,
        NO_EVENTS,
        SKIPPED_IN_FLIGHT,
        FAILED
    }

    static ScanResult noEvents(Long strategyId, int eventsInWindow) {
        return new ScanResult(strategyId, Outcome.NO_EVENTS, eventsInWindow, 0, 0, 0, 0, 0);
    }

    static ScanResult skipped(Long strategyId) {
        return new ScanResult(strategyId, Outcome.SKIPPED_IN_FLIGHT, 0, 0, 0, 0, 0, 0);
    }

    static ScanResult failed(Long strategyId) {
        return new ScanResult(strategyId, Outcome.FAILED, 0, 0, 0, 0, 0, 0);
    }
}
