package com.alerting.aggregation.api;

import com.alerting.aggregation.aggregation.processor.AggregationProcessor;
import com.alerting.aggregation.aggregation.processor.ScanResult;
import com.alerting.aggregation.domain.AlertStatus;
import com.alerting.aggregation.persistence.entity.AlertEntity;
import com.alerting.aggregation.persistence.repository.AlertRepository;
import com.alerting.aggregation.recovery.AlertRecoveryChecker;
import com.alerting.aggregation.recovery.RecoveryResult;
import com.alerting.aggregation.recovery.StaleAlertCloser;
import com.alerting.aggregation.recovery.TerminalEventReconciler;
import com.alerting.aggregation.recovery.TimeoutChecker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for AggregationController.
 */
@WebMvcTest(controllers = AggregationController.class)
class AggregationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AggregationProcessor aggregationProcessor;

    @MockitoBean
    private TimeoutChecker timeoutChecker;

    @MockitoBean
    private StaleAlertCloser staleAlertCloser;

    @MockitoBean
    private TerminalEventReconciler terminalEventReconciler;

    @MockitoBean
    private AlertRecoveryChecker alertRecoveryChecker;

    @MockitoBean
    private AlertRepository alertRepository;

    @MockitoBean
    private Clock clock;

    @Test
    void scanStrategyReturnsResult() throws Exception {
        when(aggregationProcessor.scan(7L))
                .thenReturn(new ScanResult(7L, ScanResult.Outcome.COMPLETED, 3, 3, 2, 2, 0, 0));

        mockMvc.perform(post("/api/v1/aggregation/strategies/7/scan"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategyId").value(7))
                .andExpect(jsonPath("$.outcome").value("COMPLETED"))
                .andExpect(jsonPath("$.created").value(2));
    }

    @Test
    void scanUnknownStrategyReturns404() throws Exception {
        when(aggregationProcessor.scan(404L)).thenThrow(new StrategyNotFoundException(404L));

        mockMvc.perform(post("/api/v1/aggregation/strategies/404/scan"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("STRATEGY_NOT_FOUND"));
    }

    @Test
    void scanAllReturnsOneResultPerStrategy() throws Exception {
        when(aggregationProcessor.scanActiveStrategies()).thenReturn(List.of(
                new ScanResult(1L, ScanResult.Outcome.FAILED, 0, 0, 0, 0, 0, 0),
                new ScanResult(2L, ScanResult.Outcome.NO_EVENTS, 0, 0, 0, 0, 0, 0)));

        mockMvc.perform(post("/api/v1/aggregation/scan"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].outcome").value("FAILED"));
    }

    @Test
    void sessionEndpointsReturnCounts() throws Exception {
        when(timeoutChecker.checkSessionTimeouts()).thenReturn(3);
        when(timeoutChecker.closeObservingSessionAlertsByStrategy(5L)).thenReturn(1);

        mockMvc.perform(post("/api/v1/aggregation/sessions/timeouts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmed").value(3));
        mockMvc.perform(post("/api/v1/aggregation/strategies/5/sessions/close"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.closed").value(1));
    }

    @Test
    void reconcileUsesTheLookbackWindow() throws Exception {
        when(clock.instant()).thenReturn(Instant.parse("2026-03-02T10:00:00Z"));
        when(terminalEventReconciler.reconcile(Instant.parse("2026-03-02T09:30:00Z")))
                .thenReturn(new RecoveryResult(4, 2, 1, 1, 1));

        mockMvc.perform(post("/api/v1/aggregation/reconcile").param("sinceMinutes", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.linked").value(2))
                .andExpect(jsonPath("$.skippedDuplicates").value(1));
    }

    @Test
    void reconcileRejectsOutOfRangeLookback() throws Exception {
        mockMvc.perform(post("/api/v1/aggregation/reconcile").param("sinceMinutes", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
        verifyNoInteractions(terminalEventReconciler);
    }

    @Test
    void recoveryCheckReportsStatus() throws Exception {
        AlertEntity alert = AlertEntity.builder().id(1L).alertId("ALERT-1").status(AlertStatus.AUTO_RECOVERY).build();
        when(alertRepository.findByAlertId("ALERT-1")).thenReturn(Optional.of(alert));
        when(alertRecoveryChecker.checkAndRecoverAlert(any())).thenReturn(true);

        mockMvc.perform(post("/api/v1/aggregation/alerts/ALERT-1/recovery-check"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recovered").value(true))
                .andExpect(jsonPath("$.status").value("AUTO_RECOVERY"));
    }

    @Test
    void recoveryCheckOfUnknownAlertReturns404() throws Exception {
        when(alertRepository.findByAlertId("nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/aggregation/alerts/nope/recovery-check"))
                .andExpect(status().isNotFound());
    }
}
