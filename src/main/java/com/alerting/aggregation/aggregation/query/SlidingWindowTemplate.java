package com.alerting.aggregation.aggregation.query;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything received since {@code window_start}. Recomputed every scan, so an event is
 * seen by several consecutive scans; alert updates are idempotent for that reason.
 */
@Component
public class SlidingWindowTemplate extends AbstractAggregationTemplate {

    public static final String NAME = "sliding_window";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredParameters() {
        return Set.of(TemplateParameters.DIMENSIONS, TemplateParameters.WINDOW_START,
                TemplateParameters.MIN_EVENT_COUNT, TemplateParameters.STRATEGY_ID);
    }

    @Override
    protected List<String> upperBoundPredicates(Map<String, Object> parameters) {
        return List.of();
    }

    @Override
    protected String windowTypeLabel() {
        return "sliding";
    }
}
