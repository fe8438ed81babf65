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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Links incoming RECOVERY/CLOSED events to the active alerts owning a CREATED event with
 * the same external id. One bulk query loads the candidate alerts with their events;
 * matching happens on in-memory indices, so re-delivered events are never linked twice.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecoveryHandler {

    private final AlertRepository alertRepository;
    private final AlertWriteService alertWriteService;
    private final AlertRecoveryChecker alertRecoveryChecker;

    public RecoveryResult handleRecoveryEvents(List<EventEntity> events) {
        int processed = events.size();
        List<EventEntity> usable = new ArrayList<>();
        int missingExternalId = 0;
        for (EventEntity event : events) {
            if (event.hasExternalId()) {
                usable.add(event);
            } else {
                missingExternalId++;
                log.warn("Recovery event without external id skipped: eventId={}, action={}",
                        event.getEventId(), event.getAction());
            }
        }
        if (usable.isEmpty()) {
            return RecoveryResult.empty(processed, missingExternalId);
        }

        Set<String> externalIds = usable.stream().map(EventEntity::getExternalId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        List<AlertEntity> candidates = alertRepository.findWithEventsByOwnedExternalIds(
                externalIds, EventAction.CREATED, AlertStatus.ACTIVATE_STATUSES);

        Map<String, List<AlertEntity>> alertsByExternalId = new HashMap<>();
        Map<String, Set<String>> existingEventIds = new HashMap<>();
        for (AlertEntity alert : candidates) {
            Set<String> linkedIds = new LinkedHashSet<>();
            Set<String> ownedExternalIds = new LinkedHashSet<>();
            for (EventEntity owned : alert.getEvents()) {
                linkedIds.add(owned.getEventId());
                if (owned.getAction() == EventAction.CREATED && owned.hasExternalId()
                        && externalIds.contains(owned.getExternalId())) {
                    ownedExternalIds.add(owned.getExternalId());
                }
            }
            existingEventIds.put(alert.getAlertId(), linkedIds);
            ownedExternalIds.forEach(id -> alertsByExternalId.computeIfAbsent(id, k -> new ArrayList<>()).add(alert));
        }

        int linked = 0;
        int duplicates = 0;
        Map<String, AlertEntity> changed = new LinkedHashMap<>();
        for (EventEntity event : usable) {
            for (AlertEntity alert : alertsByExternalId.getOrDefault(event.getExternalId(), List.of())) {
                Set<String> linkedIds = existingEventIds.get(alert.getAlertId());
                if (!linkedIds.add(event.getEventId())) {
                    duplicates++;
                    continue;
                }
                alert.getEvents().add(event);
                changed.put(alert.getAlertId(), alert);
                linked++;
            }
        }

        List<AlertEntity> saved = alertWriteService.saveAllInBatches(new ArrayList<>(changed.values()), "recovery-link");

        int recovered = 0;
        for (AlertEntity alert : saved) {
            if (alertRecoveryChecker.checkAndRecoverAlert(alert)) {
                recovered++;
            }
        }

        RecoveryResult result = new RecoveryResult(processed, linked, duplicates, missingExternalId, recovered);
        log.info("Recovery events handled: processed={}, linked={}, skippedDuplicates={}, skippedMissingExternalId={}, recovered={}",
                result.processed(), result.linked(), result.skippedDuplicates(), result.skippedMissingExternalId(),
                result.recovered());
        return result;
    }
}
