package com.alerting.aggregation.aggregation.query;

import com.alerting.aggregation.aggregation.window.WindowConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Picks the grouping template matching a window and renders it with the named parameters.
 */
@Slf4j
@Component
public class SqlTemplateBuilder {

    /** Grouping threshold. Fixed at 1: every distinct tuple yields a row. */
    public static final int MIN_EVENT_COUNT = 1;

    private final Map<String, AggregationTemplate> templates = new HashMap<>();

    public SqlTemplateBuilder(List<AggregationTemplate> templates) {
        for (AggregationTemplate template : templates) {
            this.templates.put(template.name(), template);
        }
        log.debug("Aggregation templates registered: {}", new TreeSet<>(this.templates.keySet()));
    }

    public String buildAggregationSql(List<String> dimensions, WindowConfig windowConfig, long strategyId) {
        if (dimensions == null || dimensions.isEmpty()) {
            throw new IllegalArgumentException("At least one dimension is required");
        }
        dimensions.forEach(EventColumns::requireKnown);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put(TemplateParameters.DIMENSIONS, List.copyOf(dimensions));
        parameters.put(TemplateParameters.WINDOW_START, TemplateParameters.formatTimestamp(windowConfig.getWindowStart()));
        parameters.put(TemplateParameters.MIN_EVENT_COUNT, MIN_EVENT_COUNT);
        parameters.put(TemplateParameters.STRATEGY_ID, strategyId);
        if (windowConfig.isSessionWindow()) {
            parameters.put(TemplateParameters.SESSION_END_TIME,
                    TemplateParameters.formatTimestamp(windowConfig.getSessionEndTime()));
        } else if (windowConfig.isFixedWindow()) {
            parameters.put(TemplateParameters.WINDOW_END, TemplateParameters.formatTimestamp(windowConfig.getWindowEnd()));
        }
        return render(templateNameFor(windowConfig), parameters);
    }

    /**
     * Renders a template by name. Fails when the template is unknown or a required
     * parameter is absent.
     */
    public String render(String templateName, Map<String, Object> parameters) {
        AggregationTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Unknown aggregation template: " + templateName);
        }
        Set<String> missing = new TreeSet<>(template.requiredParameters());
        missing.removeAll(parameters.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Template " + templateName + " is missing parameters " + missing);
        }
        return template.render(parameters);
    }

    static String templateNameFor(WindowConfig windowConfig) {
        if (windowConfig.isSessionWindow()) {
            return SessionWindowTemplate.NAME;
        }
        if (windowConfig.isFixedWindow()) {
            return FixedWindowTemplate.NAME;
        }
        return SlidingWindowTemplate.NAME;
    }
}
