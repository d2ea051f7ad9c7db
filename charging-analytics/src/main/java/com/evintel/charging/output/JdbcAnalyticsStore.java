package com.evintel.charging.output;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import com.evintel.charging.model.AnomalyRecord;
import com.evintel.charging.model.AnomalyType;
import com.evintel.charging.model.CollectionRun;
import com.evintel.charging.model.EnergyConsumptionRecord;
import com.evintel.charging.model.EngineeredFeatureRecord;
import com.evintel.charging.model.StationCycleResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Relational store for features, energy rollups, anomalies and the collection log.
 *
 * Upserts are delete-by-key then insert inside the station's transaction, so a re-run
 * replaces rather than merges. Every transaction carries the collection timeout, which is
 * what bounds a station write; the database rolls it back when it runs over.
 *
 * {@code open_key} is set only while an anomaly is open and is unique, so at most one
 * open record exists per (station, type) even if two writers race.
 */
@Component
@Slf4j
public class JdbcAnalyticsStore implements AnalyticsStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcAnalyticsStore(JdbcTemplate jdbcTemplate,
                              PlatformTransactionManager transactionManager,
                              ChargingAnalyticsProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(timeoutSeconds(properties.getCollection().getTimeoutMs()));
    }

    public void ensureSchema() {
        log.info("Ensuring analytics schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS engineered_features
            (
                station_id                  VARCHAR(255) NOT NULL,
                feature_date                DATE NOT NULL,
                hour_of_day                 INTEGER,
                day_of_week                 INTEGER NOT NULL,
                is_weekend                  BOOLEAN NOT NULL,
                is_holiday                  BOOLEAN NOT NULL,
                avg_downtime_minutes        DOUBLE PRECISION NOT NULL,
                energy_per_traffic_density  DOUBLE PRECISION,
                usage_spike_during_storm    BOOLEAN NOT NULL,
                peak_usage_hours            INTEGER NOT NULL,
                avg_wait_time_minutes       DOUBLE PRECISION NOT NULL,
                total_sessions              INTEGER NOT NULL,
                total_energy_kwh            DOUBLE PRECISION NOT NULL
            )
        """);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_features_station_date ON engineered_features (station_id, feature_date)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS energy_consumption
            (
                station_id                      VARCHAR(255) NOT NULL,
                consumption_date                DATE NOT NULL,
                total_energy_kwh                DOUBLE PRECISION NOT NULL,
                peak_hour_energy_kwh            DOUBLE PRECISION NOT NULL,
                off_peak_energy_kwh             DOUBLE PRECISION NOT NULL,
                session_count                   INTEGER NOT NULL,
                avg_session_duration_minutes    DOUBLE PRECISION,
                PRIMARY KEY (station_id, consumption_date)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS anomaly_detection
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                station_id      VARCHAR(255) NOT NULL,
                anomaly_type    VARCHAR(100) NOT NULL,
                severity_score  DOUBLE PRECISION NOT NULL,
                detected_at     TIMESTAMP NOT NULL,
                description     VARCHAR(2000),
                is_resolved     BOOLEAN NOT NULL DEFAULT FALSE,
                resolved_at     TIMESTAMP,
                open_key        VARCHAR(400) UNIQUE
            )
        """);
        jdbcTemplate.execute("""
            CREATE INDEX IF NOT EXISTS idx_anomaly_station_time ON anomaly_detection (station_id, detected_at)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS data_collection_log
            (
                run_id              VARCHAR(64) PRIMARY KEY,
                data_source         VARCHAR(100),
                collection_type     VARCHAR(100),
                period_date         VARCHAR(10),
                records_processed   INTEGER,
                records_rejected    INTEGER,
                stations_processed  INTEGER,
                stations_failed     INTEGER,
                stations_skipped    INTEGER,
                status              VARCHAR(50),
                error_message       VARCHAR(4000),
                started_at          TIMESTAMP,
                completed_at        TIMESTAMP
            )
        """);

        log.info("Analytics schema ready.");
    }

    @Override
    public void persistStationResult(StationCycleResult result) {
        transactionTemplate.executeWithoutResult(status -> {
            replaceFeatures(result.stationId(), result.date(), result.features().allRecords());
            replaceEnergy(result.features().energy());
            result.anomalies().opened().forEach(this::insertIfNotOpen);
            result.anomalies().resolved().forEach(this::markResolved);
        });
        log.debug("Persisted station {} {}: {} feature rows, {} opened, {} resolved",
                result.stationId(), result.date(), result.features().allRecords().size(),
                result.anomalies().opened().size(), result.anomalies().resolved().size());
    }

    @Override
    public List<EngineeredFeatureRecord> findDailyFeatures(String stationId, LocalDate from, LocalDate to) {
        return jdbcTemplate.query("""
                SELECT * FROM engineered_features
                WHERE station_id = ? AND hour_of_day IS NULL AND feature_date >= ? AND feature_date < ?
                ORDER BY feature_date
                """,
                (rs, i) -> mapFeature(rs), stationId, from, to);
    }

    @Override
    public List<AnomalyRecord> findOpenAnomalies(String stationId) {
        return jdbcTemplate.query("""
                SELECT * FROM anomaly_detection
                WHERE station_id = ? AND is_resolved = FALSE
                ORDER BY detected_at DESC, id DESC
                """,
                (rs, i) -> mapAnomaly(rs), stationId);
    }

    @Override
    public void writeCollectionRun(CollectionRun run) {
        transactionTemplate.executeWithoutResult(status -> jdbcTemplate.update("""
                INSERT INTO data_collection_log
                (run_id, data_source, collection_type, period_date, records_processed, records_rejected,
                 stations_processed, stations_failed, stations_skipped, status, error_message, started_at, completed_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                run.getRunId(), run.getDataSource(), run.getCollectionType(), run.getPeriodDate(),
                run.getRecordsProcessed(), run.getRecordsRejected(),
                run.getStationsProcessed(), run.getStationsFailed(), run.getStationsSkipped(),
                run.getStatus().name(), truncate(run.getErrorDetail(), 4000),
                run.getStartedAt(), run.getCompletedAt()));
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    private void replaceFeatures(String stationId, LocalDate date, List<EngineeredFeatureRecord> records) {
        jdbcTemplate.update("DELETE FROM engineered_features WHERE station_id = ? AND feature_date = ?", stationId, date);
        jdbcTemplate.batchUpdate("""
                INSERT INTO engineered_features
                (station_id, feature_date, hour_of_day, day_of_week, is_weekend, is_holiday,
                 avg_downtime_minutes, energy_per_traffic_density, usage_spike_during_storm,
                 peak_usage_hours, avg_wait_time_minutes, total_sessions, total_energy_kwh)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                records.stream().map(r -> new Object[]{
                        r.getStationId(), r.getDate(), r.getHourOfDay(), r.getDayOfWeek(),
                        r.isWeekend(), r.isHoliday(), r.getAvgDowntimeMinutes(), r.getEnergyPerTrafficDensity(),
                        r.isStormUsageSpike(), r.getPeakUsageHours(), r.getAvgWaitTimeMinutes(),
                        r.getTotalSessions(), r.getTotalEnergyKwh()
                }).toList(),
                new int[]{
                        Types.VARCHAR, Types.DATE, Types.INTEGER, Types.INTEGER,
                        Types.BOOLEAN, Types.BOOLEAN, Types.DOUBLE, Types.DOUBLE,
                        Types.BOOLEAN, Types.INTEGER, Types.DOUBLE,
                        Types.INTEGER, Types.DOUBLE
                });
    }

    private void replaceEnergy(EnergyConsumptionRecord e) {
        jdbcTemplate.update("DELETE FROM energy_consumption WHERE station_id = ? AND consumption_date = ?",
                e.getStationId(), e.getDate());
        jdbcTemplate.update("""
                INSERT INTO energy_consumption
                (station_id, consumption_date, total_energy_kwh, peak_hour_energy_kwh, off_peak_energy_kwh,
                 session_count, avg_session_duration_minutes)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
                e.getStationId(), e.getDate(), e.getTotalEnergyKwh(), e.getPeakHourEnergyKwh(),
                e.getOffPeakEnergyKwh(), e.getSessionCount(), e.getAvgSessionDurationMinutes());
    }

    /** Checked inside the station transaction so a retried write cannot open the same anomaly twice. */
    private void insertIfNotOpen(AnomalyRecord a) {
        Integer open = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM anomaly_detection
                WHERE station_id = ? AND anomaly_type = ? AND is_resolved = FALSE
                """,
                Integer.class, a.getStationId(), a.getType().code());
        if (open != null && open > 0) {
            log.debug("Station {}: {} already open, not inserted", a.getStationId(), a.getType().code());
            return;
        }
        jdbcTemplate.update("""
                INSERT INTO anomaly_detection
                (station_id, anomaly_type, severity_score, detected_at, description, open_key)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                a.getStationId(), a.getType().code(), a.getSeverityScore(), a.getDetectedAt(),
                truncate(a.getDescription(), 2000), openKey(a.getStationId(), a.getType()));
    }

    private void markResolved(AnomalyRecord a) {
        if (a.getId() == null) {
            throw new IllegalStateException("Cannot resolve an anomaly that was never stored: " + a);
        }
        jdbcTemplate.update("""
                UPDATE anomaly_detection SET is_resolved = TRUE, resolved_at = ?, open_key = NULL
                WHERE id = ? AND is_resolved = FALSE
                """,
                a.getResolvedAt(), a.getId());
    }

    // ── Row mapping ──────────────────────────────────────────────────────────

    static EngineeredFeatureRecord mapFeature(ResultSet rs) throws SQLException {
        int hour = rs.getInt("hour_of_day");
        Integer hourOfDay = rs.wasNull() ? null : hour;
        double ept = rs.getDouble("energy_per_traffic_density");
        Double energyPerTraffic = rs.wasNull() ? null : ept;
        return EngineeredFeatureRecord.builder()
                .stationId(rs.getString("station_id"))
                .date(rs.getObject("feature_date", LocalDate.class))
                .hourOfDay(hourOfDay)
                .dayOfWeek(rs.getInt("day_of_week"))
                .weekend(rs.getBoolean("is_weekend"))
                .holiday(rs.getBoolean("is_holiday"))
                .avgDowntimeMinutes(rs.getDouble("avg_downtime_minutes"))
                .energyPerTrafficDensity(energyPerTraffic)
                .stormUsageSpike(rs.getBoolean("usage_spike_during_storm"))
                .peakUsageHours(rs.getInt("peak_usage_hours"))
                .avgWaitTimeMinutes(rs.getDouble("avg_wait_time_minutes"))
                .totalSessions(rs.getInt("total_sessions"))
                .totalEnergyKwh(rs.getDouble("total_energy_kwh"))
                .build();
    }

    static AnomalyRecord mapAnomaly(ResultSet rs) throws SQLException {
        return AnomalyRecord.builder()
                .id(rs.getLong("id"))
                .stationId(rs.getString("station_id"))
                .type(AnomalyType.fromCode(rs.getString("anomaly_type")))
                .severityScore(rs.getDouble("severity_score"))
                .detectedAt(rs.getObject("detected_at", LocalDateTime.class))
                .description(rs.getString("description"))
                .resolved(rs.getBoolean("is_resolved"))
                .resolvedAt(rs.getObject("resolved_at", LocalDateTime.class))
                .build();
    }

    static String openKey(String stationId, AnomalyType type) {
        return stationId + "|" + type.code();
    }

    static int timeoutSeconds(long timeoutMs) {
        return (int) Math.max(1, (timeoutMs + 999) / 1000);
    }

    private String truncate(String val, int max) {
        if (val == null) return null;
        return val.length() > max ? val.substring(0, max) : val;
    }
}
