package com.alerting.aggregation.aggregation.query;

import java.util.List;
import java.util.Set;

/**
 * Columns of the scan-local {@code events} table. Dimension names are checked against
 * this list before they reach generated SQL.
 */
public final class EventColumns {

    public static final String TABLE = "events";

    /** Column order of the table as created by the analytical scope. */
    public static final List<String> ORDERED = List.of(
            "event_id", "external_id", "action", "received_at", "level",
            "resource_name", "resource_id", "resource_type", "item", "source_id",
            "service", "location", "event_type", "title", "description", "labels", "tags");

    private static final Set<String> KNOWN = Set.copyOf(ORDERED);

    private EventColumns() {
    }

    public static boolean isKnown(String column) {
        return column != null && KNOWN.contains(column);
    }

    public static String requireKnown(String column) {
        if (!isKnown(column)) {
            throw new IllegalArgumentException("Unknown dimension column: " + column);
        }
        return column;
    }
}
