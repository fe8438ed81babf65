package com.alerting.aggregation.aggregation.engine;

import com.alerting.aggregation.aggregation.query.FixedWindowTemplate;
import com.alerting.aggregation.aggregation.query.SessionWindowTemplate;
import com.alerting.aggregation.aggregation.query.SlidingWindowTemplate;
import com.alerting.aggregation.aggregation.query.SqlTemplateBuilder;
import com.alerting.aggregation.aggregation.window.WindowConfig;
import com.alerting.aggregation.domain.EventAction;
import com.alerting.aggregation.domain.WindowType;
import com.alerting.aggregation.persistence.entity.EventEntity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the generated SQL against a real in-memory DuckDB.
 */
class AnalyticalScopeTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final AnalyticalScope scope = new AnalyticalScope(new ObjectMapper(), "jdbc:duckdb:");
    private final SqlTemplateBuilder sqlBuilder = new SqlTemplateBuilder(
            List.of(new SlidingWindowTemplate(), new SessionWindowTemplate(), new FixedWindowTemplate()));

    @AfterEach
    void tearDown() {
        scope.shutdown();
    }

    private static EventEntity event(String eventId, String resourceName, String level, Instant receivedAt) {
        return EventEntity.builder()
                .eventId(eventId)
                .action(EventAction.CREATED)
                .resourceName(resourceName)
                .level(level)
                .title("CPU high on " + resourceName)
                .description("load " + eventId)
                .receivedAt(receivedAt)
                .labels(Map.of("team", "core"))
                .build();
    }

    private static WindowConfig sliding() {
        return WindowConfig.builder().windowType(WindowType.SLIDING).windowSizeMinutes(10).now(NOW).build();
    }

    @Test
    void groupsEventsByDimensionWithOrderedMembers() {
        scope.loadEvents(List.of(
                event("e2", "host-1", "2", NOW.minusSeconds(60)),
                event("e1", "host-1", "1", NOW.minusSeconds(180)),
                event("e3", "host-2", "3", NOW.minusSeconds(30))));

        List<Map<String, Object>> rows = scope.execute(sqlBuilder.buildAggregationSql(List.of("resource_name"), sliding(), 9L));

        assertThat(rows).hasSize(2);
        Map<String, Object> host1 = rows.get(0);
        assertThat(host1.keySet()).startsWith("resource_name", "event_count", "event_ids");
        assertThat(host1.get("resource_name")).isEqualTo("host-1");
        assertThat(((Number) host1.get("event_count")).intValue()).isEqualTo(2);
        assertThat(host1.get("event_ids")).isEqualTo(List.of("e1", "e2"));
        assertThat(host1.get("first_event_time")).isEqualTo(NOW.minusSeconds(180));
        assertThat(host1.get("last_event_time")).isEqualTo(NOW.minusSeconds(60));
        assertThat(host1.get("alert_level")).isEqualTo("1");
        assertThat(host1.get("alert_title")).isEqualTo("CPU high on host-1");
        assertThat(host1.get("alert_description")).isEqualTo("load e2");
        assertThat(((Number) host1.get("strategy_id")).longValue()).isEqualTo(9L);
        assertThat(host1.get("window_type")).isEqualTo("sliding");
    }

    @Test
    void eventsOutsideWindowOrWithoutDimensionValueAreLeftOut() {
        scope.loadEvents(List.of(
                event("old", "host-1", "1", NOW.minusSeconds(3600)),
                event("blank", "", "1", NOW.minusSeconds(10)),
                event("missing", null, "1", NOW.minusSeconds(10)),
                event("fresh", "host-1", "1", NOW.minusSeconds(10))));

        List<Map<String, Object>> rows = scope.execute(sqlBuilder.buildAggregationSql(List.of("resource_name"), sliding(), 1L));

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).get("event_ids")).isEqualTo(List.of("fresh"));
    }

    @Test
    void reloadReplacesPreviousRows() {
        scope.loadEvents(List.of(event("a", "host-1", "1", NOW.minusSeconds(10))));
        scope.loadEvents(List.of(event("b", "host-9", "1", NOW.minusSeconds(10))));

        List<Map<String, Object>> rows = scope.execute("SELECT event_id, labels FROM events");

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).get("event_id")).isEqualTo("b");
        assertThat(rows.get(0).get("labels")).isEqualTo("{\"team\":\"core\"}");
    }

    @Test
    void emptyBatchIsSkipped() {
        assertThat(scope.loadEvents(List.of())).isFalse();
        assertThat(scope.loadEvents(null)).isFalse();
    }

    @Test
    void malformedQueryPropagatesAsEngineException() {
        scope.loadEvents(List.of(event("a", "host-1", "1", NOW)));

        assertThatThrownBy(() -> scope.execute("SELECT no_such_column FROM events"))
                .isInstanceOf(AnalyticalEngineException.class);
    }

    @Test
    void eachThreadSeesItsOwnTable() throws Exception {
        scope.loadEvents(List.of(event("main-thread", "host-1", "1", NOW)));

        List<Map<String, Object>> otherThreadRows = CompletableFuture.supplyAsync(() -> {
            scope.loadEvents(List.of(event("worker-1", "host-1", "1", NOW), event("worker-2", "host-1", "1", NOW)));
            List<Map<String, Object>> rows = scope.execute("SELECT event_id FROM events ORDER BY event_id");
            scope.release();
            return rows;
        }).get();

        assertThat(otherThreadRows).extracting(row -> row.get("event_id")).containsExactly("worker-1", "worker-2");
        assertThat(scope.execute("SELECT event_id FROM events")).extracting(row -> row.get("event_id"))
                .containsExactly("main-thread");
    }
}
