package com.alerting.aggregation.aggregation.query;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Named parameters accepted by the aggregation templates, plus typed accessors that fail
 * fast when a template is rendered with a missing or mistyped value.
 */
public final class TemplateParameters {

    public static final String DIMENSIONS = "dimensions";
    public static final String WINDOW_START = "window_start";
    public static final String MIN_EVENT_COUNT = "min_event_count";
    public static final String STRATEGY_ID = "strategy_id";
    public static final String SESSION_END_TIME = "session_end_time";
    public static final String WINDOW_END = "window_end";

    /** Timestamps are rendered in UTC without offset, matching how the scope stores them. */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private TemplateParameters() {
    }

    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    static List<String> dimensions(Map<String, Object> params) {
        Object value = require(params, DIMENSIONS);
        if (!(value instanceof List) || ((List<?>) value).isEmpty()) {
            throw new IllegalArgumentException("Parameter '" + DIMENSIONS + "' must be a non-empty list");
        }
        List<String> dimensions = new ArrayList<>();
        for (Object element : (List<?>) value) {
            if (!(element instanceof String)) {
                throw new IllegalArgumentException("Parameter '" + DIMENSIONS + "' must only hold column names, got: " + element);
            }
            dimensions.add((String) element);
        }
        return dimensions;
    }

    static String timestamp(Map<String, Object> params, String name) {
        Object value = require(params, name);
        String text = value.toString();
        try {
            LocalDateTime.parse(text, TIMESTAMP_FORMAT);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' is not an ISO-8601 timestamp: " + text, e);
        }
        return text;
    }

    static long number(Map<String, Object> params, String name) {
        Object value = require(params, name);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Parameter '" + name + "' must be numeric: " + value);
        }
        return ((Number) value).longValue();
    }

    private static Object require(Map<String, Object> params, String name) {
        Object value = params.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing template parameter: " + name);
        }
        return value;
    }
}
