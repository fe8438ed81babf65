package com.alerting.aggregation.messaging;

import com.alerting.aggregation.persistence.entity.EventEntity;
import com.alerting.aggregation.persistence.repository.EventRepository;
import com.alerting.aggregation.recovery.RecoveryResult;
import com.alerting.aggregation.recovery.TerminalEventReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reacts to freshly ingested events. RECOVERY and CLOSED events are reconciled right away
 * instead of waiting for the next scan cycle; CREATED events are left to the scans.
 * Redelivery is harmless since reconciliation is idempotent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "alerting.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class EventLifecycleConsumer {

    private final EventRepository eventRepository;
    private final TerminalEventReconciler terminalEventReconciler;

    @KafkaListener(
            topics = "${alerting.kafka.topic.event-lifecycle:alert-event-lifecycle}",
            groupId = "${alerting.kafka.consumer-group:alert-aggregation-engine}",
            containerFactory = "eventLifecycleListenerContainerFactory"
    )
    public void onEventLifecycle(
            @Payload(required = false) EventLifecycleMessage message,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        if (message == null || message.getEventIds() == null || message.getEventIds().isEmpty()) {
            log.warn("Empty lifecycle message ignored: key={}, offset={}", key, offset);
            return;
        }
        try {
            List<EventEntity> events = eventRepository.findByEventIdIn(message.getEventIds());
            if (events.size() < message.getEventIds().size()) {
                log.warn("Lifecycle message names unknown events: source={}, requested={}, found={}",
                        message.getSource(), message.getEventIds().size(), events.size());
            }
            RecoveryResult result = terminalEventReconciler.reconcile(events);
            log.info("Lifecycle message handled: source={}, events={}, linked={}, recovered={}",
                    message.getSource(), events.size(), result.linked(), result.recovered());
        } catch (Exception e) {
            log.error("Error handling lifecycle message key={} offset={}; events are picked up by the next reconcile cycle",
                    key, offset, e);
        }
    }
}
