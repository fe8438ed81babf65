package com.alerting.aggregation.recovery;

import com.alerting.aggregation.domain.EventAction;
import com.alerting.aggregation.persistence.entity.EventEntity;
import com.alerting.aggregation.persistence.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Feeds RECOVERY and CLOSED events into the close and recovery passes. Both passes are
 * idempotent, so overlapping reconcile windows are harmless.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TerminalEventReconciler {

    private final EventRepository eventRepository;
    private final AutoCloser autoCloser;
    private final RecoveryHandler recoveryHandler;

    public RecoveryResult reconcile(Instant since) {
        List<EventEntity> terminal = eventRepository.findByActionsSince(
                EnumSet.of(EventAction.RECOVERY, EventAction.CLOSED), since);
        return reconcile(terminal);
    }

    public RecoveryResult reconcile(List<EventEntity> events) {
        List<EventEntity> terminal = events.stream()
                .filter(event -> event.getAction() != null && event.getAction().isTerminal())
                .collect(Collectors.toList());
        if (terminal.isEmpty()) {
            return RecoveryResult.empty(0, 0);
        }
        int closed = autoCloser.handleClosedEvents(terminal);
        RecoveryResult result = recoveryHandler.handleRecoveryEvents(terminal);
        log.debug("Terminal events reconciled: events={}, autoClosed={}, linked={}, recovered={}",
                terminal.size(), closed, result.linked(), result.recovered());
        return result;
    }
}
