package com.alerting.aggregation.recovery;

import com.alerting.aggregation.domain.AlertStatus;
import com.alerting.aggregation.domain.EventAction;
import com.alerting.aggregation.persistence.entity.AlertEntity;
import com.alerting.aggregation.persistence.entity.EventEntity;
import com.alerting.aggregation.persistence.repository.AlertRepository;
import com.alerting.aggregation.persistence.service.AlertWriteService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Closes active alerts whose source condition was closed: a CLOSED event carrying an
 * external id closes every active alert owning an event with that id. Ordering relative
 * to the alert's other events does not matter.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoCloser {

    private final AlertRepository alertRepository;
    private final AlertWriteService alertWriteService;

    /**
     * @return number of alerts moved to AUTO_CLOSE
     */
    public int handleClosedEvents(List<EventEntity> events) {
        Set<String> externalIds = new LinkedHashSet<>();
        for (EventEntity event : events) {
            if (event.getAction() != EventAction.CLOSED) {
                continue;
            }
            if (!event.hasExternalId()) {
                log.warn("CLOSED event without external id cannot close anything: eventId={}", event.getEventId());
                continue;
            }
            externalIds.add(event.getExternalId());
        }
        if (externalIds.isEmpty()) {
            return 0;
        }

        List<AlertEntity> toClose = alertRepository.findByEventExternalIds(externalIds, AlertStatus.ACTIVATE_STATUSES)
                .stream()
                .filter(alert -> alert.getStatus().isActive())
                .collect(Collectors.toList());
        toClose.forEach(alert -> alert.setStatus(AlertStatus.AUTO_CLOSE));

        int closed = alertWriteService.saveInBatches(toClose, "auto-close");
        if (closed > 0) {
            log.info("Alerts auto-closed by CLOSED events: externalIds={}, closed={}", externalIds.size(), closed);
        }
        return closed;
    }
}
