package com.evintel.charging.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-side queries over the analytics tables for the REST surface.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnalyticsQueryService {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Anomalies, most recent first.
     *
     * @param stationId null for all stations
     * @param openOnly  only records not yet resolved
     * @param limit     max rows, 1..1000
     */
    public List<Map<String, Object>> getAnomalies(String stationId, boolean openOnly, int limit) {
        if (limit < 1 || limit > 1000) {
            throw new IllegalArgumentException("limit must be between 1 and 1000");
        }
        StringBuilder sql = new StringBuilder("""
            SELECT id, station_id, anomaly_type, severity_score, detected_at,
                   description, is_resolved, resolved_at
            FROM anomaly_detection
            WHERE 1 = 1
            """);
        List<Object> args = new ArrayList<>();
        if (stationId != null && !stationId.isBlank()) {
            sql.append(" AND station_id = ?");
            args.add(stationId.trim());
        }
        if (openOnly) {
            sql.append(" AND is_resolved = FALSE");
        }
        sql.append(" ORDER BY detected_at DESC, id DESC LIMIT ?");
        args.add(limit);

        return jdbcTemplate.queryForList(sql.toString(), args.toArray());
    }

    /**
     * Daily and hourly feature rows for one station over [from, to].
     */
    public Map<String, Object> getFeatures(String stationId, LocalDate from, LocalDate to, boolean includeHourly) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("to must not be before from");
        }
        log.info("Feature query for {} {}..{}, hourly {}", stationId, from, to, includeHourly);

        String featureQuery = """
            SELECT *
            FROM engineered_features
            WHERE station_id = ?
              AND feature_date >= ?
              AND feature_date <= ?
              %s
            ORDER BY feature_date ASC, hour_of_day ASC NULLS FIRST
            """.formatted(includeHourly ? "" : "AND hour_of_day IS NULL");
        List<Map<String, Object>> features = jdbcTemplate.queryForList(featureQuery, stationId, from, to);

        String energyQuery = """
            SELECT consumption_date, total_energy_kwh, peak_hour_energy_kwh, off_peak_energy_kwh,
                   session_count, avg_session_duration_minutes
            FROM energy_consumption
            WHERE station_id = ?
              AND consumption_date >= ?
              AND consumption_date <= ?
            ORDER BY consumption_date ASC
            """;
        List<Map<String, Object>> energy = jdbcTemplate.queryForList(energyQuery, stationId, from, to);

        return Map.of(
                "stationId", stationId,
                "from", from.toString(),
                "to", to.toString(),
                "features", features,
                "energy", energy
        );
    }

    /** Most recent cycles from the collection log. */
    public List<Map<String, Object>> getRecentRuns(int limit) {
        return jdbcTemplate.queryForList("""
            SELECT run_id, period_date, status, records_processed, records_rejected,
                   stations_processed, stations_failed, stations_skipped,
                   error_message, started_at, completed_at
            FROM data_collection_log
            ORDER BY started_at DESC
            LIMIT ?
            """, Math.max(1, Math.min(limit, 200)));
    }
}
