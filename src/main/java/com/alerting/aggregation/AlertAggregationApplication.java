package com.alerting.aggregation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Alert Aggregation Engine. Enables:
 * <ul>
 *   <li>Scheduled strategy scans grouping events into alerts (DuckDB in-memory scope)</li>
 *   <li>Auto-close, auto-recovery and session timeout reconciliation</li>
 *   <li>Kafka lifecycle notifications for immediate recovery/close handling</li>
 *   <li>Operator REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class AlertAggregationApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertAggregationApplication.class, args);
    }
}
