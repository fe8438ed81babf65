package com.alerting.aggregation.recovery;

import com.alerting.aggregation.domain.AlertStatus;
import com.alerting.aggregation.persistence.entity.AlertEntity;
import com.alerting.aggregation.persistence.entity.StrategyEntity;
import com.alerting.aggregation.persistence.repository.AlertRepository;
import com.alerting.aggregation.persistence.repository.StrategyRepository;
import com.alerting.aggregation.persistence.service.AlertWriteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closes active alerts of auto-close strategies once no event arrived for
 * {@code close_minutes}. Session alerts still observing do not count down.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StaleAlertCloser {

    private final StrategyRepository strategyRepository;
    private final AlertRepository alertRepository;
    private final AlertWriteService alertWriteService;
    private final Clock clock;

    public int closeStaleAlerts() {
        Map<Long, StrategyEntity> strategies = strategyRepository
                .findByActiveTrueAndAutoCloseTrueAndCloseMinutesGreaterThan(0)
                .stream()
                .collect(Collectors.toMap(StrategyEntity::getId, Function.identity()));
        if (strategies.isEmpty()) {
            return 0;
        }

        Instant now = clock.instant();
        List<AlertEntity> stale = new ArrayList<>();
        for (AlertEntity alert : alertRepository.findByRuleIdInAndStatusIn(strategies.keySet(), AlertStatus.ACTIVATE_STATUSES)) {
            if (alert.isObservingSession()) {
                continue;
            }
            if (alert.getLastEventTime() == null) {
                log.warn("Alert without last event time cannot age out: alertId={}", alert.getAlertId());
                continue;
            }
            StrategyEntity strategy = strategies.get(alert.getRuleId());
            Instant closeAt = alert.getLastEventTime().plus(Duration.ofMinutes(strategy.getCloseMinutes()));
            if (!now.isBefore(closeAt)) {
                alert.setStatus(AlertStatus.AUTO_CLOSE);
                stale.add(alert);
            }
        }
        int closed = alertWriteService.saveInBatches(stale, "stale-close");
        if (closed > 0) {
            log.info("Stale alerts auto-closed: closed={}", closed);
        }
        return closed;
    }
}
