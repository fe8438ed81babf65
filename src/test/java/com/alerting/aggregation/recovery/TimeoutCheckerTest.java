package com.alerting.aggregation.recovery;

import com.alerting.aggregation.domain.AlertStatus;
import com.alerting.aggregation.domain.SessionStatus;
import com.alerting.aggregation.persistence.entity.AlertEntity;
import com.alerting.aggregation.persistence.repository.AlertRepository;
import com.alerting.aggregation.persistence.service.AlertWriteService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeoutCheckerTest {

    private static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private AlertRepository alertRepository;

    @Mock
    private AlertWriteService alertWriteService;

    private TimeoutChecker timeoutChecker;

    @BeforeEach
    void setUp() {
        timeoutChecker = new TimeoutChecker(alertRepository, alertWriteService,
                Clock.fixed(T0.plusSeconds(11 * 60), ZoneOffset.UTC));
    }

    private static AlertEntity observing(String alertId, Instant sessionEndTime) {
        return AlertEntity.builder().alertId(alertId).ruleId(4L).status(AlertStatus.UNASSIGNED)
                .sessionAlert(true).sessionStatus(SessionStatus.OBSERVING).sessionEndTime(sessionEndTime).build();
    }

    @Test
    void expiredSessionIsConfirmedAndStaysActive() {
        AlertEntity expired = observing("A1", T0.plusSeconds(10 * 60));
        AlertEntity running = observing("A2", T0.plusSeconds(20 * 60));
        when(alertRepository.findSessionAlertsWithDeadline(SessionStatus.OBSERVING, AlertStatus.ACTIVATE_STATUSES))
                .thenReturn(List.of(expired, running));
        when(alertWriteService.saveInBatches(List.of(expired), "session-timeout")).thenReturn(1);

        assertThat(timeoutChecker.checkSessionTimeouts()).isEqualTo(1);
        assertThat(expired.getSessionStatus()).isEqualTo(SessionStatus.CONFIRMED);
        assertThat(expired.getStatus()).isEqualTo(AlertStatus.UNASSIGNED);
        assertThat(running.getSessionStatus()).isEqualTo(SessionStatus.OBSERVING);
    }

    @Test
    void deadlineEqualToNowCountsAsExpired() {
        AlertEntity due = observing("A3", T0.plusSeconds(11 * 60));
        when(alertRepository.findSessionAlertsWithDeadline(SessionStatus.OBSERVING, AlertStatus.ACTIVATE_STATUSES))
                .thenReturn(List.of(due));
        when(alertWriteService.saveInBatches(List.of(due), "session-timeout")).thenReturn(1);

        assertThat(timeoutChecker.checkSessionTimeouts()).isEqualTo(1);
    }

    @Test
    void strategyConfirmSkipsTheDeadline() {
        AlertEntity alert = observing("A4", T0.plusSeconds(3600));
        when(alertRepository.findSessionAlertsByRule(4L, SessionStatus.OBSERVING)).thenReturn(List.of(alert));
        when(alertWriteService.saveInBatches(List.of(alert), "strategy-confirm")).thenReturn(1);

        assertThat(timeoutChecker.confirmObservingAlertsByStrategy(4L)).isEqualTo(1);
        assertThat(alert.getSessionStatus()).isEqualTo(SessionStatus.CONFIRMED);
    }

    @Test
    void strategyCloseRecoversTheSessionAndClosesTheAlert() {
        AlertEntity alert = observing("A5", T0.plusSeconds(3600));
        when(alertRepository.findSessionAlertsByRule(4L, SessionStatus.OBSERVING)).thenReturn(List.of(alert));
        when(alertWriteService.saveInBatches(List.of(alert), "strategy-close")).thenReturn(1);

        assertThat(timeoutChecker.closeObservingSessionAlertsByStrategy(4L)).isEqualTo(1);
        assertThat(alert.getSessionStatus()).isEqualTo(SessionStatus.RECOVERED);
        assertThat(alert.getStatus()).isEqualTo(AlertStatus.CLOSED);
    }
}
