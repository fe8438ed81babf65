package com.alerting.aggregation.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an alert. PENDING, PROCESSING and UNASSIGNED form the "activate"
 * family: alerts in those states still accept events and reconciliation.
 */
public enum AlertStatus {
    PENDING,
    PROCESSING,
    UNASSIGNED,
    RESOLVED,
    AUTO_RECOVERY,
    AUTO_CLOSE,
    CLOSED;

    public static final Set<AlertStatus> ACTIVATE_STATUSES =
            EnumSet.of(PENDING, PROCESSING, UNASSIGNED);

    public static final Set<AlertStatus> CLOSED_STATUSES =
            EnumSet.of(CLOSED, AUTO_CLOSE);

    public boolean isActive() {
        return ACTIVATE_STATUSES.contains(this);
    }
}
