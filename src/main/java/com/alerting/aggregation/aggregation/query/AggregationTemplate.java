package com.alerting.aggregation.aggregation.query;

import java.util.Map;
import java.util.Set;

/**
 * A named grouping query. Implementations turn the named parameters into DuckDB SQL over
 * the scan-local events table.
 */
public interface AggregationTemplate {

    String name();

    Set<String> requiredParameters();

    String render(Map<String, Object> parameters);
}
