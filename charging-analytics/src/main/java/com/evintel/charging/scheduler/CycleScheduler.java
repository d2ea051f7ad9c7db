package com.evintel.charging.scheduler;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import com.evintel.charging.output.JdbcAnalyticsStore;
import com.evintel.charging.service.JdbcCollectorGateway;
import com.evintel.charging.service.PipelineCoordinator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup cycles.
 *
 * Default schedule: every two hours on the hour, UTC, processing the current UTC date.
 * Each run recomputes the whole day, so later runs replace earlier partial results.
 *
 * Override with the charging-analytics.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CycleScheduler {

    private final PipelineCoordinator coordinator;
    private final JdbcCollectorGateway collectorGateway;
    private final JdbcAnalyticsStore analyticsStore;
    private final ChargingAnalyticsProperties properties;

    /**
     * On application startup:
     *  1. Ensure the landing and analytics schemas exist
     *  2. Optionally backfill the configured number of days
     */
    @PostConstruct
    public void onStartup() {
        try {
            collectorGateway.ensureSchema();
            analyticsStore.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise schema: {}", e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            int days = properties.getScheduling().getBackfillDays();
            log.info("runOnStartup=true, running backfill for {} days", days);
            try {
                coordinator.backfill(days);
            } catch (Exception e) {
                log.error("Startup backfill failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Pipeline ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${charging-analytics.scheduling.cron:0 0 */2 * * *}", zone = "UTC")
    public void scheduledCycle() {
        log.info("Scheduled cycle triggered");
        try {
            coordinator.runLatest();
        } catch (Exception e) {
            log.error("Scheduled cycle failed: {}", e.getMessage(), e);
        }
    }
}
