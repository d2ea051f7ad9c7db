package com.evintel.charging.config;

import com.evintel.charging.model.CycleReport;
import com.evintel.charging.service.AnalyticsQueryService;
import com.evintel.charging.service.CorrelationAnalysisService;
import com.evintel.charging.service.PipelineCoordinator;
import com.evintel.charging.service.UsagePatternService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineCoordinator coordinator;
    private final AnalyticsQueryService queryService;
    private final CorrelationAnalysisService correlationService;
    private final UsagePatternService patternService;

    // ── Cycle triggers ────────────────────────────────────────────────────────

    @PostMapping("/pipeline/trigger/latest")
    public ResponseEntity<Map<String, String>> triggerLatest() {
        new Thread(coordinator::runLatest, "manual-cycle-latest").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "latest"));
    }

    @PostMapping("/pipeline/trigger/{date}")
    public ResponseEntity<Map<String, String>> triggerDate(@PathVariable String date) {
        LocalDate target;
        try {
            target = LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "date must be YYYY-MM-DD"));
        }
        new Thread(() -> coordinator.runCycle(target), "manual-cycle-" + date).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", date));
    }

    @PostMapping("/pipeline/backfill")
    public ResponseEntity<Map<String, String>> backfill(@RequestParam(defaultValue = "30") int days) {
        if (days < 1 || days > 366) {
            return ResponseEntity.badRequest().body(Map.of("error", "days must be between 1 and 366"));
        }
        new Thread(() -> coordinator.backfill(days), "manual-backfill").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "days", String.valueOf(days)));
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "ev-intel-charging-analytics");
        body.put("version", "1.0.0");
        coordinator.lastReport().ifPresent(r -> body.put("lastCycle", summary(r)));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/pipeline/runs")
    public ResponseEntity<?> runs(@RequestParam(defaultValue = "20") int limit) {
        try {
            return ResponseEntity.ok(queryService.getRecentRuns(limit));
        } catch (Exception e) {
            log.error("Run log query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    // ── Analytics query API ───────────────────────────────────────────────────

    /**
     * GET /anomalies?stationId=ST-1&openOnly=true&limit=100
     */
    @GetMapping("/anomalies")
    public ResponseEntity<?> getAnomalies(
            @RequestParam(required = false) String stationId,
            @RequestParam(defaultValue = "false") boolean openOnly,
            @RequestParam(defaultValue = "100") int limit) {
        try {
            List<Map<String, Object>> result = queryService.getAnomalies(stationId, openOnly, limit);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Anomaly query failed for station {}: {}", stationId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /features?stationId=ST-1&from=2024-03-01&to=2024-03-31&hourly=false
     */
    @GetMapping("/features")
    public ResponseEntity<?> getFeatures(
            @RequestParam String stationId,
            @RequestParam String from,
            @RequestParam String to,
            @RequestParam(defaultValue = "false") boolean hourly) {
        try {
            Map<String, Object> result = queryService.getFeatures(
                    stationId, LocalDate.parse(from), LocalDate.parse(to), hourly);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Feature query failed for station {}: {}", stationId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /analytics/correlations?stationId=ST-1
     */
    @GetMapping("/analytics/correlations")
    public ResponseEntity<?> getCorrelations(@RequestParam(required = false) String stationId) {
        try {
            return ResponseEntity.ok(correlationService.getCorrelationReport(stationId));
        } catch (Exception e) {
            log.error("Correlation report failed for station {}: {}", stationId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /analytics/patterns?stationId=ST-1
     */
    @GetMapping("/analytics/patterns")
    public ResponseEntity<?> getPatterns(@RequestParam(required = false) String stationId) {
        try {
            return ResponseEntity.ok(patternService.getUsagePatterns(stationId));
        } catch (Exception e) {
            log.error("Usage pattern query failed for station {}: {}", stationId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    private Map<String, Object> summary(CycleReport report) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("runId", report.run().getRunId());
        m.put("date", report.run().getPeriodDate());
        m.put("status", report.run().getStatus().name());
        m.put("stationsProcessed", report.run().getStationsProcessed());
        m.put("stationsFailed", report.run().getStationsFailed());
        m.put("stationsSkipped", report.run().getStationsSkipped());
        m.put("recordsProcessed", report.run().getRecordsProcessed());
        m.put("recordsRejected", report.run().getRecordsRejected());
        m.put("startedAt", String.valueOf(report.run().getStartedAt()));
        m.put("completedAt", String.valueOf(report.run().getCompletedAt()));
        m.put("stations", report.stations());
        return m;
    }
}
