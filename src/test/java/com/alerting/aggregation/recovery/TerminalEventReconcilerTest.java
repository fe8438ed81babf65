package com.alerting.aggregation.recovery;

import com.alerting.aggregation.domain.EventAction;
import com.alerting.aggregation.persistence.entity.EventEntity;
import com.alerting.aggregation.persistence.repository.EventRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TerminalEventReconcilerTest {

    private static final Instant SINCE = Instant.parse("2026-03-02T09:45:00Z");

    @Mock
    private EventRepository eventRepository;

    @Mock
    private AutoCloser autoCloser;

    @Mock
    private RecoveryHandler recoveryHandler;

    @InjectMocks
    private TerminalEventReconciler reconciler;

    private static EventEntity event(String eventId, EventAction action) {
        return EventEntity.builder().eventId(eventId).action(action).externalId("X").receivedAt(SINCE).build();
    }

    @Test
    void closesBeforeLinkingRecoveries() {
        EventEntity closed = event("c1", EventAction.CLOSED);
        EventEntity recovery = event("r1", EventAction.RECOVERY);
        List<EventEntity> terminal = List.of(closed, recovery);
        when(eventRepository.findByActionsSince(EnumSet.of(EventAction.RECOVERY, EventAction.CLOSED), SINCE))
                .thenReturn(terminal);
        when(recoveryHandler.handleRecoveryEvents(terminal)).thenReturn(new RecoveryResult(2, 1, 0, 0, 1));

        RecoveryResult result = reconciler.reconcile(SINCE);

        assertThat(result.linked()).isEqualTo(1);
        InOrder order = inOrder(autoCloser, recoveryHandler);
        order.verify(autoCloser).handleClosedEvents(terminal);
        order.verify(recoveryHandler).handleRecoveryEvents(terminal);
    }

    @Test
    void createdEventsAreFilteredOut() {
        RecoveryResult result = reconciler.reconcile(List.of(event("e1", EventAction.CREATED)));

        assertThat(result.processed()).isZero();
        verifyNoInteractions(autoCloser, recoveryHandler);
    }
}
