package com.alerting.aggregation.domain;

/**
 * Observation state of a session-window alert. Moves forward only:
 * OBSERVING to CONFIRMED (no recovery arrived in time) or RECOVERED.
 */
public enum SessionStatus {
    OBSERVING,
    CONFIRMED,
    RECOVERED;

    public boolean canTransitionTo(SessionStatus target) {
        if (target == null || target == this) {
            return false;
        }
        return this == OBSERVING;
    }
}
