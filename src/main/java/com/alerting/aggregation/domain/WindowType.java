package com.alerting.aggregation.domain;

/**
 * Time-window semantics used when grouping events of a strategy.
 */
public enum WindowType {
    /** Fixed-duration lookback recomputed on every scan. */
    SLIDING,
    /** Window stays open (OBSERVING) until a timeout elapses or a recovery arrives. */
    SESSION,
    /** Windows aligned to multiples of the window size; only complete windows are grouped. */
    FIXED
}
