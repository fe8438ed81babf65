package com.alerting.aggregation.api;

import com.alerting.aggregation.aggregation.processor.AggregationProcessor;
import com.alerting.aggregation.aggregation.processor.ScanResult;
import com.alerting.aggregation.persistence.repository.AlertRepository;
import com.alerting.aggregation.recovery.AlertRecoveryChecker;
import com.alerting.aggregation.recovery.RecoveryResult;
import com.alerting.aggregation.recovery.StaleAlertCloser;
import com.alerting.aggregation.recovery.TerminalEventReconciler;
import com.alerting.aggregation.recovery.TimeoutChecker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Operator hooks into the aggregation engine: on-demand scans and the reconciliation
 * passes normally run by the scheduler, plus the strategy-change session operations.
 * Every operation is idempotent.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/aggregation")
@RequiredArgsConstructor
@Tag(name = "Aggregation", description = "Event aggregation scans and alert lifecycle reconciliation")
public class AggregationController {

    private final AggregationProcessor aggregationProcessor;
    private final TimeoutChecker timeoutChecker;
    private final StaleAlertCloser staleAlertCloser;
    private final TerminalEventReconciler terminalEventReconciler;
    private final AlertRecoveryChecker alertRecoveryChecker;
    private final AlertRepository alertRepository;
    private final Clock clock;

    @PostMapping("/strategies/{strategyId}/scan")
    @Operation(summary = "Scan one strategy", description = "Groups the strategy's window events into alerts now. Skipped if a scan of the same strategy is in flight.")
    public ResponseEntity<ScanResult> scanStrategy(@PathVariable Long strategyId) {
        return ResponseEntity.ok(aggregationProcessor.scan(strategyId));
    }

    @PostMapping("/scan")
    @Operation(summary = "Scan all active strategies")
    public ResponseEntity<List<ScanResult>> scanAll() {
        return ResponseEntity.ok(aggregationProcessor.scanActiveStrategies());
    }

    @PostMapping("/sessions/timeouts")
    @Operation(summary = "Confirm expired sessions", description = "Marks observing session alerts past their deadline as CONFIRMED; status is unchanged.")
    public ResponseEntity<Map<String, Integer>> checkSessionTimeouts() {
        return ResponseEntity.ok(Map.of("confirmed", timeoutChecker.checkSessionTimeouts()));
    }

    @PostMapping("/strategies/{strategyId}/sessions/confirm")
    @Operation(summary = "Confirm a strategy's observing sessions", description = "Used when session behaviour is switched off for the strategy.")
    public ResponseEntity<Map<String, Integer>> confirmObservingAlerts(@PathVariable Long strategyId) {
        return ResponseEntity.ok(Map.of("confirmed", timeoutChecker.confirmObservingAlertsByStrategy(strategyId)));
    }

    @PostMapping("/strategies/{strategyId}/sessions/close")
    @Operation(summary = "Close a strategy's observing sessions", description = "Used when the strategy is deleted. Status CLOSED, session RECOVERED.")
    public ResponseEntity<Map<String, Integer>> closeObservingSessionAlerts(@PathVariable Long strategyId) {
        return ResponseEntity.ok(Map.of("closed", timeoutChecker.closeObservingSessionAlertsByStrategy(strategyId)));
    }

    @PostMapping("/alerts/stale/close")
    @Operation(summary = "Close stale alerts", description = "Auto-closes alerts of auto-close strategies that saw no event for close_minutes.")
    public ResponseEntity<Map<String, Integer>> closeStaleAlerts() {
        return ResponseEntity.ok(Map.of("closed", staleAlertCloser.closeStaleAlerts()));
    }

    @PostMapping("/reconcile")
    @Operation(summary = "Reconcile terminal events", description = "Runs auto-close and recovery linking over RECOVERY/CLOSED events of the last N minutes.")
    public ResponseEntity<RecoveryResult> reconcile(@RequestParam(defaultValue = "15") long sinceMinutes) {
        if (sinceMinutes <= 0 || sinceMinutes > 10_080) {
            throw new IllegalArgumentException("sinceMinutes must be between 1 and 10080");
        }
        return ResponseEntity.ok(terminalEventReconciler.reconcile(clock.instant().minus(Duration.ofMinutes(sinceMinutes))));
    }

    @PostMapping("/alerts/{alertId}/recovery-check")
    @Operation(summary = "Re-check one alert for recovery")
    public ResponseEntity<Map<String, Object>> checkRecovery(@PathVariable String alertId) {
        return alertRepository.findByAlertId(alertId)
                .map(alert -> {
                    boolean recovered = alertRecoveryChecker.checkAndRecoverAlert(alert);
                    log.info("Manual recovery check: alertId={}, recovered={}", alertId, recovered);
                    return ResponseEntity.ok(Map.<String, Object>of(
                            "alertId", alertId,
                            "recovered", recovered,
                            "status", alert.getStatus().name()));
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
