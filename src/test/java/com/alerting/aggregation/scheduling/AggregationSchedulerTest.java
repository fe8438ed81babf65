package com.alerting.aggregation.scheduling;

import com.alerting.aggregation.aggregation.processor.AggregationProcessor;
import com.alerting.aggregation.recovery.StaleAlertCloser;
import com.alerting.aggregation.recovery.TerminalEventReconciler;
import com.alerting.aggregation.recovery.TimeoutChecker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AggregationSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private AggregationProcessor aggregationProcessor;

    @Mock
    private TerminalEventReconciler terminalEventReconciler;

    @Mock
    private TimeoutChecker timeoutChecker;

    @Mock
    private StaleAlertCloser staleAlertCloser;

    private AggregationScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new AggregationScheduler(aggregationProcessor, terminalEventReconciler, timeoutChecker,
                staleAlertCloser, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(scheduler, "reconcileLookbackMinutes", 15L);
    }

    @Test
    void scanCycleReconcilesTheLookbackWindowAfterScanning() {
        when(aggregationProcessor.scanActiveStrategies()).thenReturn(List.of());

        scheduler.runScanCycle();

        verify(terminalEventReconciler).reconcile(Instant.parse("2026-03-02T09:45:00Z"));
    }

    @Test
    void failingJobsDoNotEscapeTheScheduler() {
        when(aggregationProcessor.scanActiveStrategies()).thenThrow(new IllegalStateException("boom"));
        when(timeoutChecker.checkSessionTimeouts()).thenThrow(new IllegalStateException("boom"));
        when(staleAlertCloser.closeStaleAlerts()).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> {
            scheduler.runScanCycle();
            scheduler.runSessionTimeoutCheck();
            scheduler.runStaleAlertClose();
        }).doesNotThrowAnyException();
    }
}
