package com.alerting.aggregation.scheduling;

import com.alerting.aggregation.aggregation.processor.AggregationProcessor;
import com.alerting.aggregation.aggregation.processor.ScanResult;
import com.alerting.aggregation.recovery.StaleAlertCloser;
import com.alerting.aggregation.recovery.TerminalEventReconciler;
import com.alerting.aggregation.recovery.TimeoutChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Recurring jobs. A failed run is logged and simply retried on the next tick.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "alerting.aggregation.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class AggregationScheduler {

    private final AggregationProcessor aggregationProcessor;
    private final TerminalEventReconciler terminalEventReconciler;
    private final TimeoutChecker timeoutChecker;
    private final StaleAlertCloser staleAlertCloser;
    private final Clock clock;

    @Value("${alerting.aggregation.reconcile-lookback-minutes:15}")
    private long reconcileLookbackMinutes;

    @Scheduled(initialDelayString = "${alerting.aggregation.scan-initial-delay:10000}",
            fixedDelayString = "${alerting.aggregation.scan-interval:60000}")
    public void runScanCycle() {
        try {
            List<ScanResult> results = aggregationProcessor.scanActiveStrategies();
            terminalEventReconciler.reconcile(clock.instant().minus(Duration.ofMinutes(reconcileLookbackMinutes)));
            log.debug("Scan cycle finished: strategies={}", results.size());
        } catch (RuntimeException e) {
            log.error("Scan cycle failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${alerting.aggregation.timeout-check-interval:300000}")
    public void runSessionTimeoutCheck() {
        try {
            timeoutChecker.checkSessionTimeouts();
        } catch (RuntimeException e) {
            log.error("Session timeout check failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${alerting.aggregation.stale-close-interval:600000}")
    public void runStaleAlertClose() {
        try {
            staleAlertCloser.closeStaleAlerts();
        } catch (RuntimeException e) {
            log.error("Stale alert close failed", e);
        }
    }
}
