package com.alerting.aggregation.recovery;

import com.alerting.aggregation.domain.AlertStatus;
import com.alerting.aggregation.domain.EventAction;
import com.alerting.aggregation.domain.SessionStatus;
import com.alerting.aggregation.persistence.entity.AlertEntity;
import com.alerting.aggregation.persistence.entity.EventEntity;
import com.alerting.aggregation.persistence.repository.AlertRepository;
import com.alerting.aggregation.persistence.service.AlertWriteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether one alert has fully recovered.
 *
 * <p>Every CREATED event of the alert needs a RECOVERY or CLOSED event with the same
 * external id that arrived strictly later. A CREATED event without an external id can
 * never be matched and keeps the alert active.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertRecoveryChecker {

    private final AlertRepository alertRepository;
    private final AlertWriteService alertWriteService;

    /**
     * @return true if the alert is in AUTO_RECOVERY after the call
     */
    public boolean checkAndRecoverAlert(AlertEntity alert) {
        List<EventEntity> events = alert.getId() == null
                ? new ArrayList<>(alert.getEvents())
                : alertRepository.findEventsOfAlert(alert.getId());
        if (events.isEmpty()) {
            return false;
        }

        List<EventEntity> created = new ArrayList<>();
        Map<String, List<Instant>> terminalArrivals = new HashMap<>();
        for (EventEntity event : events) {
            if (event.getAction() == EventAction.CREATED) {
                created.add(event);
            } else if (event.getAction() != null && event.getAction().isTerminal() && event.hasExternalId()) {
                terminalArrivals.computeIfAbsent(event.getExternalId(), k -> new ArrayList<>()).add(event.getReceivedAt());
            }
        }
        if (created.isEmpty() && terminalArrivals.isEmpty()) {
            return false;
        }

        for (EventEntity createdEvent : created) {
            if (!createdEvent.hasExternalId()) {
                log.warn("CREATED event without external id can never recover: alertId={}, eventId={}",
                        alert.getAlertId(), createdEvent.getEventId());
                return false;
            }
            if (!recoveredAfter(createdEvent, terminalArrivals.get(createdEvent.getExternalId()))) {
                return false;
            }
        }

        boolean changed = alert.getStatus() != AlertStatus.AUTO_RECOVERY;
        alert.setStatus(AlertStatus.AUTO_RECOVERY);
        if (alert.isObservingSession()) {
            changed |= alert.advanceSessionStatus(SessionStatus.RECOVERED);
        }
        if (!changed) {
            return true;
        }
        if (alertWriteService.saveInBatches(List.of(alert), "auto-recovery") == 0) {
            return false;
        }
        log.info("Alert auto-recovered: alertId={}, createdEvents={}", alert.getAlertId(), created.size());
        return true;
    }

    private static boolean recoveredAfter(EventEntity createdEvent, List<Instant> terminalArrivals) {
        if (terminalArrivals == null || createdEvent.getReceivedAt() == null) {
            return false;
        }
        for (Instant arrival : terminalArrivals) {
            if (arrival != null && arrival.isAfter(createdEvent.getReceivedAt())) {
                return true;
            }
        }
        return false;
    }
}
