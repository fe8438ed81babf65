package com.alerting.aggregation.aggregation.builder;

import com.alerting.aggregation.aggregation.fingerprint.FingerprintGenerator;
import com.alerting.aggregation.aggregation.window.WindowConfig;
import com.alerting.aggregation.domain.AlertStatus;
import com.alerting.aggregation.domain.SessionStatus;
import com.alerting.aggregation.persistence.entity.AlertEntity;
import com.alerting.aggregation.persistence.entity.EventEntity;
import com.alerting.aggregation.persistence.entity.StrategyEntity;
import com.alerting.aggregation.persistence.repository.AlertRepository;
import com.alerting.aggregation.persistence.service.AlertWriteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Diffs grouped rows against the strategy's active alerts: a row whose fingerprint matches
 * an active alert updates it, any other row opens a new alert.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertBuilder {

    static final String DEFAULT_TITLE = "Aggregated alert";

    private final AlertRepository alertRepository;
    private final AlertWriteService alertWriteService;
    private final FingerprintGenerator fingerprintGenerator;

    /**
     * Applies the rows in batches, one transaction per batch.
     *
     * @param eventsById the events loaded for this scan, used to link members without re-reading them
     */
    public AlertBuildResult apply(List<Map<String, Object>> rows,
                                  StrategyEntity strategy,
                                  List<String> dimensions,
                                  WindowConfig windowConfig,
                                  Map<String, EventEntity> eventsById) {
        if (rows == null || rows.isEmpty()) {
            return AlertBuildResult.empty();
        }
        return alertWriteService.inBatches(rows, "aggregation",
                        batch -> applyBatch(batch, strategy, dimensions, windowConfig, eventsById))
                .stream()
                .reduce(AlertBuildResult.empty(), AlertBuildResult::plus);
    }

    private AlertBuildResult applyBatch(List<Map<String, Object>> rows,
                                        StrategyEntity strategy,
                                        List<String> dimensions,
                                        WindowConfig windowConfig,
                                        Map<String, EventEntity> eventsById) {
        int created = 0;
        int updated = 0;
        int linked = 0;
        List<AlertEntity> touched = new ArrayList<>();
        List<AlertEntity> newAlerts = new ArrayList<>();

        for (Map<String, Object> row : rows) {
            Map<String, String> dimensionValues = dimensionValues(row, dimensions);
            String fingerprint = fingerprintGenerator.fingerprint(dimensionValues);
            List<String> eventIds = eventIds(row);

            List<AlertEntity> existing = alertRepository.findByRuleIdAndFingerprintAndStatusInOrderByUpdatedAtDesc(
                    strategy.getId(), fingerprint, AlertStatus.ACTIVATE_STATUSES);
            if (existing.size() > 1) {
                log.warn("Several active alerts share a fingerprint, updating the newest: strategyId={}, fingerprint={}, count={}",
                        strategy.getId(), fingerprint, existing.size());
            }

            if (existing.isEmpty()) {
                AlertEntity alert = newAlert(row, strategy, dimensions, windowConfig, fingerprint);
                linked += link(alert, eventIds, Set.of(), eventsById);
                newAlerts.add(alert);
                touched.add(alert);
                created++;
            } else {
                AlertEntity alert = existing.get(0);
                refresh(alert, row, windowConfig);
                linked += link(alert, eventIds, alertRepository.findLinkedEventIds(alert.getId()), eventsById);
                touched.add(alert);
                updated++;
            }
        }
        if (!newAlerts.isEmpty()) {
            alertRepository.saveAll(newAlerts);
        }
        log.debug("Alert batch applied: strategyId={}, created={}, updated={}, linkedEvents={}",
                strategy.getId(), created, updated, linked);
        return new AlertBuildResult(created, updated, linked, touched);
    }

    private AlertEntity newAlert(Map<String, Object> row, StrategyEntity strategy, List<String> dimensions,
                                 WindowConfig windowConfig, String fingerprint) {
        boolean session = windowConfig.isSessionWindow();
        String title = stringValue(row.get("alert_title"));
        String content = stringValue(row.get("alert_description"));
        return AlertEntity.builder()
                .alertId("ALERT-" + UUID.randomUUID().toString().replace("-", "").toUpperCase(Locale.ROOT))
                .fingerprint(fingerprint)
                .ruleId(strategy.getId())
                .status(AlertStatus.UNASSIGNED)
                .level(stringValue(row.get("alert_level")))
                .title(title == null || title.isBlank() ? DEFAULT_TITLE : title)
                .content(content == null ? "" : content)
                .groupByField(String.join(",", dimensions))
                .sessionAlert(session)
                .sessionStatus(session ? SessionStatus.OBSERVING : null)
                .sessionEndTime(session ? windowConfig.getSessionEndTime() : null)
                .firstEventTime(toInstant(row.get("first_event_time")))
                .lastEventTime(toInstant(row.get("last_event_time")))
                .build();
    }

    private void refresh(AlertEntity alert, Map<String, Object> row, WindowConfig windowConfig) {
        Instant lastEventTime = toInstant(row.get("last_event_time"));
        if (lastEventTime != null && (alert.getLastEventTime() == null || lastEventTime.isAfter(alert.getLastEventTime()))) {
            alert.setLastEventTime(lastEventTime);
        }
        String level = stringValue(row.get("alert_level"));
        if (level != null) {
            alert.setLevel(level);
        }
        if (alert.isObservingSession() && windowConfig.isSessionWindow()) {
            alert.setSessionEndTime(windowConfig.getSessionEndTime());
        }
    }

    private static int link(AlertEntity alert, List<String> eventIds, Set<String> alreadyLinked,
                            Map<String, EventEntity> eventsById) {
        int added = 0;
        for (String eventId : eventIds) {
            if (alreadyLinked.contains(eventId)) {
                continue;
            }
            EventEntity event = eventsById.get(eventId);
            if (event == null) {
                log.warn("Grouped event not in scan batch, not linked: alertId={}, eventId={}", alert.getAlertId(), eventId);
                continue;
            }
            if (alert.getEvents().add(event)) {
                added++;
            }
        }
        return added;
    }

    /** Every grouped row must carry a non-blank value per dimension before it is fingerprinted. */
    private Map<String, String> dimensionValues(Map<String, Object> row, List<String> dimensions) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String dimension : dimensions) {
            Object value = row.get(dimension);
            values.put(dimension, value == null ? null : value.toString());
        }
        fingerprintGenerator.validateDimensions(values);
        return values;
    }

    private static List<String> eventIds(Map<String, Object> row) {
        Object raw = row.get("event_ids");
        List<String> ids = new ArrayList<>();
        if (raw instanceof List) {
            for (Object id : (List<?>) raw) {
                if (id != null) {
                    ids.add(id.toString());
                }
            }
        }
        return ids;
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        return null;
    }
}
