package com.alerting.aggregation.aggregation.query;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Last complete aligned window, {@code [window_start, window_end)}. Each event belongs to
 * exactly one fixed window.
 */
@Component
public class FixedWindowTemplate extends AbstractAggregationTemplate {

    public static final String NAME = "fixed_window";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredParameters() {
        return Set.of(TemplateParameters.DIMENSIONS, TemplateParameters.WINDOW_START,
                TemplateParameters.MIN_EVENT_COUNT, TemplateParameters.STRATEGY_ID,
                TemplateParameters.WINDOW_END);
    }

    @Override
    protected List<String> upperBoundPredicates(Map<String, Object> parameters) {
        String windowEnd = TemplateParameters.timestamp(parameters, TemplateParameters.WINDOW_END);
        return List.of("received_at < " + timestampLiteral(windowEnd));
    }

    @Override
    protected String windowTypeLabel() {
        return "fixed";
    }
}
