package com.alerting.aggregation.domain;

/**
 * What an event reports about the condition it belongs to. CREATED opens a condition,
 * RECOVERY and CLOSED terminate it.
 */
public enum EventAction {
    CREATED,
    RECOVERY,
    CLOSED;

    public boolean isTerminal() {
        return this == RECOVERY || this == CLOSED;
    }
}
