package com.alerting.aggregation.aggregation.processor;

import com.alerting.aggregation.aggregation.builder.AlertBuildResult;
import com.alerting.aggregation.aggregation.builder.AlertBuilder;
import com.alerting.aggregation.aggregation.dimension.DimensionResolver;
import com.alerting.aggregation.aggregation.engine.AnalyticalScope;
import com.alerting.aggregation.aggregation.matcher.StrategyMatcher;
import com.alerting.aggregation.aggregation.query.SqlTemplateBuilder;
import com.alerting.aggregation.aggregation.window.WindowConfig;
import com.alerting.aggregation.aggregation.window.WindowFactory;
import com.alerting.aggregation.api.StrategyNotFoundException;
import com.alerting.aggregation.domain.EventAction;
import com.alerting.aggregation.persistence.entity.AlertEntity;
import com.alerting.aggregation.persistence.entity.EventEntity;
import com.alerting.aggregation.persistence.entity.StrategyEntity;
import com.alerting.aggregation.persistence.repository.EventRepository;
import com.alerting.aggregation.persistence.repository.StrategyRepository;
import com.alerting.aggregation.recovery.AlertRecoveryChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs strategy scans: window, match rules, grouping in the analytical scope, then the
 * alert diff and a recovery check on every touched alert.
 *
 * <p>Dimension sets are tried in order. Each set groups what the previous sets could not,
 * i.e. events with no value for the preferred dimension fall through to the next set,
 * down to one alert per event. Only one scan per strategy runs at a time; a scan
 * requested while another is in flight is skipped.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationProcessor {

    private final StrategyRepository strategyRepository;
    private final EventRepository eventRepository;
    private final WindowFactory windowFactory;
    private final StrategyMatcher strategyMatcher;
    private final DimensionResolver dimensionResolver;
    private final SqlTemplateBuilder sqlTemplateBuilder;
    private final AnalyticalScope analyticalScope;
    private final AlertBuilder alertBuilder;
    private final AlertRecoveryChecker alertRecoveryChecker;

    private final Map<Long, Thread> inFlight = new ConcurrentHashMap<>();

    /**
     * Scans one strategy.
     *
     * @throws StrategyNotFoundException if no strategy has that id
     */
    public ScanResult scan(Long strategyId) {
        StrategyEntity strategy = strategyRepository.findById(strategyId)
                .orElseThrow(() -> new StrategyNotFoundException(strategyId));
        try {
            return scanStrategy(strategy);
        } finally {
            analyticalScope.release();
        }
    }

    /**
     * Scans every active strategy, newest first. A failing strategy is logged and reported
     * without stopping the others.
     */
    public List<ScanResult> scanActiveStrategies() {
        List<StrategyEntity> strategies = strategyRepository.findByActiveTrueOrderByUpdatedAtDesc();
        if (strategies.isEmpty()) {
            log.info("No active strategies, aggregation cycle skipped");
            return List.of();
        }
        log.info("Aggregation cycle started: strategies={}", strategies.size());
        List<ScanResult> results = new ArrayList<>();
        try {
            for (StrategyEntity strategy : strategies) {
                try {
                    results.add(scanStrategy(strategy));
                } catch (RuntimeException e) {
                    log.error("Strategy scan failed, retried next cycle: strategyId={}, name={}",
                            strategy.getId(), strategy.getName(), e);
                    results.add(ScanResult.failed(strategy.getId()));
                }
            }
        } finally {
            analyticalScope.release();
        }
        return results;
    }

    private ScanResult scanStrategy(StrategyEntity strategy) {
        Long strategyId = strategy.getId();
        if (inFlight.putIfAbsent(strategyId, Thread.currentThread()) != null) {
            log.info("Scan already in flight, skipped: strategyId={}", strategyId);
            return ScanResult.skipped(strategyId);
        }
        try {
            return doScan(strategy);
        } finally {
            inFlight.remove(strategyId);
        }
    }

    private ScanResult doScan(StrategyEntity strategy) {
        Long strategyId = strategy.getId();
        WindowConfig window = windowFactory.createFromStrategy(strategy);
        List<EventEntity> events = loadWindowEvents(window);
        log.info("Scanning strategy: strategyId={}, name={}, window={}, size={}min, events={}",
                strategyId, strategy.getName(), window.getWindowType(), window.getWindowSizeMinutes(), events.size());
        if (events.isEmpty()) {
            return ScanResult.noEvents(strategyId, 0);
        }

        List<EventEntity> matched = strategyMatcher.filter(events, strategy.getMatchRules());
        if (matched.isEmpty()) {
            log.info("No event matched the strategy rules: strategyId={}", strategyId);
            return ScanResult.noEvents(strategyId, events.size());
        }
        Map<String, EventEntity> eventsById = matched.stream()
                .collect(Collectors.toMap(EventEntity::getEventId, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        List<EventEntity> remaining = matched;
        AlertBuildResult built = AlertBuildResult.empty();
        int groups = 0;
        for (List<String> dimensions : dimensionResolver.resolve(strategy.getDimensionType(), strategy.getCustomDimensions())) {
            if (remaining.isEmpty() || !analyticalScope.loadEvents(remaining)) {
                break;
            }
            String sql = sqlTemplateBuilder.buildAggregationSql(dimensions, window, strategyId);
            List<Map<String, Object>> rows = analyticalScope.execute(sql);
            if (rows.isEmpty()) {
                log.debug("No group for dimensions, trying next set: strategyId={}, dimensions={}", strategyId, dimensions);
                continue;
            }
            groups += rows.size();
            built = built.plus(alertBuilder.apply(rows, strategy, dimensions, window, eventsById));

            Set<String> grouped = groupedEventIds(rows);
            remaining = remaining.stream()
                    .filter(event -> !grouped.contains(event.getEventId()))
                    .collect(Collectors.toList());
            log.debug("Dimension set applied: strategyId={}, dimensions={}, groups={}, remainingEvents={}",
                    strategyId, dimensions, rows.size(), remaining.size());
        }

        int recovered = 0;
        for (AlertEntity alert : built.alerts()) {
            if (alert.getStatus().isActive() && alertRecoveryChecker.checkAndRecoverAlert(alert)) {
                recovered++;
            }
        }

        ScanResult result = new ScanResult(strategyId, ScanResult.Outcome.COMPLETED, events.size(), matched.size(),
                groups, built.created(), built.updated(), recovered);
        log.info("Strategy scan complete: strategyId={}, groups={}, created={}, updated={}, recovered={}",
                strategyId, groups, result.created(), result.updated(), recovered);
        return result;
    }

    private List<EventEntity> loadWindowEvents(WindowConfig window) {
        if (window.isSessionWindow()) {
            return eventRepository.findByActionWithin(EventAction.CREATED, window.getWindowStart(), window.getSessionEndTime());
        }
        if (window.isFixedWindow()) {
            return eventRepository.findByActionBefore(EventAction.CREATED, window.getWindowStart(), window.getWindowEnd());
        }
        return eventRepository.findByActionSince(EventAction.CREATED, window.getWindowStart());
    }

    private static Set<String> groupedEventIds(List<Map<String, Object>> rows) {
        Set<String> ids = new HashSet<>();
        for (Map<String, Object> row : rows) {
            Object raw = row.get("event_ids");
            if (raw instanceof List) {
                for (Object id : (List<?>) raw) {
                    ids.add(String.valueOf(id));
                }
            }
        }
        return ids;
    }
}
