package com.alerting.aggregation.recovery;

import com.alerting.aggregation.domain.AlertStatus;
import com.alerting.aggregation.domain.SessionStatus;
import com.alerting.aggregation.persistence.entity.AlertEntity;
import com.alerting.aggregation.persistence.repository.AlertRepository;
import com.alerting.aggregation.persistence.service.AlertWriteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Session-window deadlines. An observing session whose deadline passed without a recovery
 * is confirmed; its status stays active.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeoutChecker {

    private final AlertRepository alertRepository;
    private final AlertWriteService alertWriteService;
    private final Clock clock;

    /**
     * @return number of sessions confirmed
     */
    public int checkSessionTimeouts() {
        Instant now = clock.instant();
        List<AlertEntity> expired = new ArrayList<>();
        for (AlertEntity alert : alertRepository.findSessionAlertsWithDeadline(
                SessionStatus.OBSERVING, AlertStatus.ACTIVATE_STATUSES)) {
            if (!alert.getSessionEndTime().isAfter(now) && alert.advanceSessionStatus(SessionStatus.CONFIRMED)) {
                expired.add(alert);
            }
        }
        int confirmed = alertWriteService.saveInBatches(expired, "session-timeout");
        if (confirmed > 0) {
            log.info("Session alerts confirmed after timeout: confirmed={}", confirmed);
        }
        return confirmed;
    }

    /**
     * Confirms every observing session alert of the strategy, e.g. after session behaviour
     * was switched off.
     */
    public int confirmObservingAlertsByStrategy(Long strategyId) {
        List<AlertEntity> observing = new ArrayList<>();
        for (AlertEntity alert : alertRepository.findSessionAlertsByRule(strategyId, SessionStatus.OBSERVING)) {
            if (alert.advanceSessionStatus(SessionStatus.CONFIRMED)) {
                observing.add(alert);
            }
        }
        int confirmed = alertWriteService.saveInBatches(observing, "strategy-confirm");
        log.info("Observing session alerts confirmed: strategyId={}, confirmed={}", strategyId, confirmed);
        return confirmed;
    }

    /**
     * Closes every observing session alert of the strategy and marks its session
     * RECOVERED, e.g. after the strategy was deleted.
     */
    public int closeObservingSessionAlertsByStrategy(Long strategyId) {
        List<AlertEntity> observing = new ArrayList<>();
        for (AlertEntity alert : alertRepository.findSessionAlertsByRule(strategyId, SessionStatus.OBSERVING)) {
            if (alert.advanceSessionStatus(SessionStatus.RECOVERED)) {
                alert.setStatus(AlertStatus.CLOSED);
                observing.add(alert);
            }
        }
        int closed = alertWriteService.saveInBatches(observing, "strategy-close");
        log.info("Observing session alerts closed: strategyId={}, closed={}", strategyId, closed);
        return closed;
    }
}
