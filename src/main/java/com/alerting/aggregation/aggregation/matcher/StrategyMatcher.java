package com.alerting.aggregation.aggregation.matcher;

import com.alerting.aggregation.persistence.entity.EventEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Filters events by a strategy's match rules. The outer list is OR-ed, each inner list is
 * AND-ed. A condition is {@code {key, operator, value}}; keys naming no event field are
 * looked up in the event's labels, then its tags.
 *
 * <p>Invalid conditions are skipped with a warning. When no valid condition remains, every
 * event matches.</p>
 */
@Slf4j
@Component
public class StrategyMatcher {

    private static final Map<String, Function<EventEntity, String>> FIELDS = Map.ofEntries(
            Map.entry("title", EventEntity::getTitle),
            Map.entry("description", EventEntity::getDescription),
            Map.entry("content", EventEntity::getDescription),
            Map.entry("level", EventEntity::getLevel),
            Map.entry("level_id", EventEntity::getLevel),
            Map.entry("source", EventEntity::getSourceId),
            Map.entry("source_id", EventEntity::getSourceId),
            Map.entry("resource_type", EventEntity::getResourceType),
            Map.entry("resource_name", EventEntity::getResourceName),
            Map.entry("resource_id", EventEntity::getResourceId),
            Map.entry("event_type", EventEntity::getEventType),
            Map.entry("service", EventEntity::getService),
            Map.entry("location", EventEntity::getLocation),
            Map.entry("event_id", EventEntity::getEventId),
            Map.entry("external_id", EventEntity::getExternalId),
            Map.entry("item", EventEntity::getItem));

    public List<EventEntity> filter(List<EventEntity> events, List<List<Map<String, Object>>> matchRules) {
        Predicate<EventEntity> predicate = compile(matchRules);
        return events.stream().filter(predicate).collect(Collectors.toList());
    }

    /**
     * Compiles the rules once so a large batch is not re-parsed per event.
     */
    public Predicate<EventEntity> compile(List<List<Map<String, Object>>> matchRules) {
        if (matchRules == null || matchRules.isEmpty()) {
            return event -> true;
        }
        List<Predicate<EventEntity>> orGroups = new ArrayList<>();
        for (List<Map<String, Object>> andGroup : matchRules) {
            if (andGroup == null || andGroup.isEmpty()) {
                continue;
            }
            List<Predicate<EventEntity>> conditions = new ArrayList<>();
            for (Map<String, Object> condition : andGroup) {
                Predicate<EventEntity> compiled = compileCondition(condition);
                if (compiled != null) {
                    conditions.add(compiled);
                }
            }
            if (!conditions.isEmpty()) {
                orGroups.add(conditions.stream().reduce(Predicate::and).get());
            }
        }
        if (orGroups.isEmpty()) {
            log.warn("No valid match rule condition, every event matches: rules={}", matchRules);
            return event -> true;
        }
        return orGroups.stream().reduce(Predicate::or).get();
    }

    private Predicate<EventEntity> compileCondition(Map<String, Object> condition) {
        if (condition == null) {
            return null;
        }
        Object rawKey = condition.get("key");
        Object rawOperator = condition.get("operator");
        Object value = condition.get("value");
        if (rawKey == null || rawKey.toString().isBlank() || rawOperator == null) {
            log.warn("Skipping match condition without key or operator: {}", condition);
            return null;
        }
        String key = rawKey.toString().trim();
        String operator = rawOperator.toString().trim().toLowerCase(Locale.ROOT);
        if (value == null && !"ne".equals(operator)) {
            log.warn("Skipping match condition without value: {}", condition);
            return null;
        }
        Function<EventEntity, String> field = fieldAccessor(key);

        switch (operator) {
            case "eq":
                return event -> valueEquals(field.apply(event), value);
            case "ne":
                return event -> !valueEquals(field.apply(event), value);
            case "contains":
            case "not_contains": {
                String needle = value.toString().toLowerCase(Locale.ROOT);
                if (needle.isEmpty()) {
                    log.warn("Skipping {} condition with empty value: {}", operator, condition);
                    return null;
                }
                Predicate<EventEntity> contains = event -> {
                    String actual = field.apply(event);
                    return actual != null && actual.toLowerCase(Locale.ROOT).contains(needle);
                };
                return "contains".equals(operator) ? contains : contains.negate();
            }
            case "re":
            case "regex": {
                Pattern pattern = compilePattern(value.toString(), condition);
                if (pattern == null) {
                    return null;
                }
                return event -> {
                    String actual = field.apply(event);
                    return actual != null && pattern.matcher(actual).find();
                };
            }
            case "gt":
            case "gte":
            case "lt":
            case "lte": {
                BigDecimal threshold = toNumber(value);
                if (threshold == null) {
                    log.warn("Skipping {} condition with non-numeric value: {}", operator, condition);
                    return null;
                }
                return event -> compareNumber(field.apply(event), threshold, operator);
            }
            case "in":
            case "not_in": {
                if (!(value instanceof Collection)) {
                    log.warn("Skipping {} condition whose value is not a list: {}", operator, condition);
                    return null;
                }
                List<String> candidates = ((Collection<?>) value).stream()
                        .filter(Objects::nonNull)
                        .map(Object::toString)
                        .collect(Collectors.toList());
                Predicate<EventEntity> in = event -> candidates.contains(field.apply(event));
                return "in".equals(operator) ? in : in.negate();
            }
            default:
                log.warn("Skipping match condition with unsupported operator '{}': {}", operator, condition);
                return null;
        }
    }

    private static Function<EventEntity, String> fieldAccessor(String key) {
        Function<EventEntity, String> direct = FIELDS.get(key);
        if (direct != null) {
            return direct;
        }
        return event -> {
            if (event.getLabels() != null && event.getLabels().containsKey(key)) {
                return event.getLabels().get(key);
            }
            return event.getTags() == null ? null : event.getTags().get(key);
        };
    }

    private static boolean valueEquals(String actual, Object expected) {
        if (expected == null) {
            return actual == null;
        }
        if (actual == null) {
            return false;
        }
        if (expected instanceof Number) {
            BigDecimal actualNumber = toNumber(actual);
            return actualNumber != null && actualNumber.compareTo(toNumber(expected)) == 0;
        }
        return actual.equals(expected.toString());
    }

    private static boolean compareNumber(String actual, BigDecimal threshold, String operator) {
        BigDecimal number = toNumber(actual);
        if (number == null) {
            return false;
        }
        int cmp = number.compareTo(threshold);
        switch (operator) {
            case "gt":
                return cmp > 0;
            case "gte":
                return cmp >= 0;
            case "lt":
                return cmp < 0;
            default:
                return cmp <= 0;
        }
    }

    private static BigDecimal toNumber(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        if (!text.matches("-?\\d+(\\.\\d+)?")) {
            return null;
        }
        return new BigDecimal(text);
    }

    private static Pattern compilePattern(String regex, Map<String, Object> condition) {
        if (regex.isEmpty()) {
            log.warn("Skipping regex condition with empty pattern: {}", condition);
            return null;
        }
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            log.warn("Skipping regex condition with invalid pattern '{}': {}", regex, e.getDescription());
            return null;
        }
    }
}
