package com.alerting.aggregation.aggregation.query;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class SessionWindowTemplate extends AbstractAggregationTemplate {

    public static final String NAME = "session_window";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredParameters() {
        return Set.of(TemplateParameters.DIMENSIONS, TemplateParameters.WINDOW_START,
                TemplateParameters.MIN_EVENT_COUNT, TemplateParameters.STRATEGY_ID,
                TemplateParameters.SESSION_END_TIME);
    }

    @Override
    protected List<String> upperBoundPredicates(Map<String, Object> parameters) {
        String sessionEnd = TemplateParameters.timestamp(parameters, TemplateParameters.SESSION_END_TIME);
        return List.of("received_at <= " + timestampLiteral(sessionEnd));
    }

    @Override
    protected String windowTypeLabel() {
        return "session";
    }
}
