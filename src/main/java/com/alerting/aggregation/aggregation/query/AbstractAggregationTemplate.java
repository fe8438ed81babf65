package com.alerting.aggregation.aggregation.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared shape of the grouping queries: one row per distinct dimension tuple with the
 * member events ordered by arrival. Rows whose dimension value is NULL or empty are left
 * out so a looser dimension set can group those events.
 */
abstract class AbstractAggregationTemplate implements AggregationTemplate {

    @Override
    public String render(Map<String, Object> parameters) {
        List<String> dimensions = TemplateParameters.dimensions(parameters);
        dimensions.forEach(EventColumns::requireKnown);
        String windowStart = TemplateParameters.timestamp(parameters, TemplateParameters.WINDOW_START);
        long minEventCount = TemplateParameters.number(parameters, TemplateParameters.MIN_EVENT_COUNT);
        long strategyId = TemplateParameters.number(parameters, TemplateParameters.STRATEGY_ID);

        String dimensionColumns = dimensions.stream().map(AbstractAggregationTemplate::quote)
                .collect(Collectors.joining(", "));

        List<String> predicates = new ArrayList<>();
        predicates.add("received_at >= " + timestampLiteral(windowStart));
        predicates.addAll(upperBoundPredicates(parameters));
        for (String dimension : dimensions) {
            predicates.add(quote(dimension) + " IS NOT NULL");
            predicates.add("TRIM(CAST(" + quote(dimension) + " AS VARCHAR)) <> ''");
        }

        return "SELECT " + dimensionColumns + ",\n"
                + "       COUNT(*) AS event_count,\n"
                + "       LIST(event_id ORDER BY received_at, event_id) AS event_ids,\n"
                + "       MIN(received_at) AS first_event_time,\n"
                + "       MAX(received_at) AS last_event_time,\n"
                + "       MIN(level) AS alert_level,\n"
                + "       ARG_MIN(title, received_at) AS alert_title,\n"
                + "       ARG_MAX(description, received_at) AS alert_description,\n"
                + "       " + strategyId + " AS strategy_id,\n"
                + "       '" + windowTypeLabel() + "' AS window_type\n"
                + "FROM " + EventColumns.TABLE + "\n"
                + "WHERE " + String.join("\n  AND ", predicates) + "\n"
                + "GROUP BY " + dimensionColumns + "\n"
                + "HAVING COUNT(*) >= " + minEventCount + "\n"
                + "ORDER BY first_event_time, " + dimensionColumns;
    }

    /** Extra bounds on {@code received_at} beyond the window start. */
    protected abstract List<String> upperBoundPredicates(Map<String, Object> parameters);

    /** Value of the {@code window_type} output column. */
    protected abstract String windowTypeLabel();

    protected static String timestampLiteral(String isoTimestamp) {
        return "CAST('" + isoTimestamp.replace("'", "''") + "' AS TIMESTAMP)";
    }

    private static String quote(String column) {
        return "\"" + column + "\"";
    }
}
