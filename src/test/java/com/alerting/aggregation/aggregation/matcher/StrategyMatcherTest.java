package com.alerting.aggregation.aggregation.matcher;

import com.alerting.aggregation.domain.EventAction;
import com.alerting.aggregation.persistence.entity.EventEntity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyMatcherTest {

    private final StrategyMatcher matcher = new StrategyMatcher();

    private static EventEntity event(String eventId, String title, String level, String sourceId) {
        return EventEntity.builder()
                .eventId(eventId)
                .action(EventAction.CREATED)
                .title(title)
                .level(level)
                .sourceId(sourceId)
                .receivedAt(Instant.now())
                .labels(new HashMap<>(Map.of("env", "prod")))
                .build();
    }

    private static Map<String, Object> condition(String key, String operator, Object value) {
        Map<String, Object> condition = new HashMap<>();
        condition.put("key", key);
        condition.put("operator", operator);
        condition.put("value", value);
        return condition;
    }

    private final List<EventEntity> events = List.of(
            event("e1", "CPU high", "1", "zabbix"),
            event("e2", "Disk full", "2", "prometheus"),
            event("e3", "cpu throttled", "3", "zabbix"));

    @Test
    void noRulesMatchEverything() {
        assertThat(matcher.filter(events, List.of())).hasSize(3);
        assertThat(matcher.filter(events, null)).hasSize(3);
    }

    @Test
    void innerConditionsAreAndedOuterGroupsAreOred() {
        List<List<Map<String, Object>>> rules = List.of(
                List.of(condition("title", "contains", "cpu"), condition("level", "eq", 1)),
                List.of(condition("source", "eq", "prometheus")));

        assertThat(matcher.filter(events, rules)).extracting(EventEntity::getEventId).containsExactly("e1", "e2");
    }

    @Test
    void regexAndNumericComparisons() {
        assertThat(matcher.filter(events, List.of(List.of(condition("title", "re", "^cpu")))))
                .extracting(EventEntity::getEventId).containsExactly("e1", "e3");
        assertThat(matcher.filter(events, List.of(List.of(condition("level", "gte", "2")))))
                .extracting(EventEntity::getEventId).containsExactly("e2", "e3");
        assertThat(matcher.filter(events, List.of(List.of(condition("level", "lt", 2)))))
                .extracting(EventEntity::getEventId).containsExactly("e1");
    }

    @Test
    void inNotInAndNegations() {
        assertThat(matcher.filter(events, List.of(List.of(condition("event_id", "in", List.of("e1", "e3"))))))
                .extracting(EventEntity::getEventId).containsExactly("e1", "e3");
        assertThat(matcher.filter(events, List.of(List.of(condition("event_id", "not_in", List.of("e1"))))))
                .extracting(EventEntity::getEventId).containsExactly("e2", "e3");
        assertThat(matcher.filter(events, List.of(List.of(condition("title", "not_contains", "CPU")))))
                .extracting(EventEntity::getEventId).containsExactly("e2");
        assertThat(matcher.filter(events, List.of(List.of(condition("source_id", "ne", "zabbix")))))
                .extracting(EventEntity::getEventId).containsExactly("e2");
    }

    @Test
    void unknownKeysAreLookedUpInLabels() {
        assertThat(matcher.filter(events, List.of(List.of(condition("env", "eq", "prod"))))).hasSize(3);
        assertThat(matcher.filter(events, List.of(List.of(condition("env", "eq", "dev"))))).isEmpty();
    }

    @Test
    void invalidConditionsAreSkipped() {
        List<List<Map<String, Object>>> rules = List.of(List.of(
                condition("title", "re", "(unclosed"),
                condition("level", "in", "not-a-list"),
                condition("", "eq", "x"),
                condition("title", "between", "a"),
                condition("source", "eq", "zabbix")));

        assertThat(matcher.filter(events, rules)).extracting(EventEntity::getEventId).containsExactly("e1", "e3");
    }

    @Test
    void onlyInvalidConditionsMatchEverything() {
        List<List<Map<String, Object>>> rules = List.of(List.of(condition("title", "gt", "abc")), List.of());

        assertThat(matcher.filter(events, rules)).hasSize(3);
    }
}
